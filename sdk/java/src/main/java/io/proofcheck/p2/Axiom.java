package io.proofcheck.p2;

import java.util.Locale;
import java.util.Optional;

/**
 * The three axiom schemas of the Łukasiewicz (P2) system, in prefix notation.
 */
public enum Axiom {
    /** P → (Q → P) */
    AX1("cPcQP"),
    /** (S → (P → Q)) → ((S → P) → (S → Q)) */
    AX2("ccScPQccSPcSQ"),
    /** (¬P → ¬Q) → (Q → P) */
    AX3("ccnPnQcQP");

    private final String patternText;
    private final Formula pattern;

    Axiom(String patternText) {
        this.patternText = patternText;
        this.pattern = WffParser.withDefaults().parse(patternText);
    }

    public String patternText() {
        return patternText;
    }

    public Formula pattern() {
        return pattern;
    }

    public boolean isInstance(Formula formula) {
        return PatternMatcher.matches(pattern, formula);
    }

    public Optional<Bindings> instantiation(Formula formula) {
        return PatternMatcher.match(pattern, formula);
    }

    /** Case-insensitive lookup by name, e.g. {@code "ax2"}. */
    public static Optional<Axiom> named(String name) {
        if (name == null) return Optional.empty();
        String wanted = name.trim().toUpperCase(Locale.ROOT);
        for (Axiom axiom : values()) {
            if (axiom.name().equals(wanted)) return Optional.of(axiom);
        }
        return Optional.empty();
    }
}
