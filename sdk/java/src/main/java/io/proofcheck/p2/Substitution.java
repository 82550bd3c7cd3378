package io.proofcheck.p2;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Uniform replacement of one propositional variable by a formula.
 */
public record Substitution(char variable, Formula replacement) {
    private static final Pattern SPEC = Pattern.compile("\\s*([A-Z])\\s*=\\s*(\\S.*?)\\s*");

    public Substitution {
        if (variable < 'A' || variable > 'Z') {
            throw new IllegalArgumentException("variable must be an uppercase letter: '" + variable + "'");
        }
        Objects.requireNonNull(replacement, "replacement");
    }

    public Formula applyTo(Formula formula) {
        return formula.substitute(variable, replacement);
    }

    /** Does applying this substitution to {@code source} give exactly {@code target}? */
    public boolean yields(Formula source, Formula target) {
        return Formula.equal(applyTo(source), target);
    }

    /**
     * Parse {@code V=WFF}, e.g. {@code "Q = cPR"}. Empty if the text does not have that shape.
     * @throws WffSyntaxException if the shape is right but the replacement is not a formula
     */
    public static Optional<Substitution> parse(String text, WffParser parser) {
        Matcher m = SPEC.matcher(text);
        if (!m.matches()) return Optional.empty();
        Formula replacement = parser.parse(m.group(2));
        return Optional.of(new Substitution(m.group(1).charAt(0), replacement));
    }

    @Override
    public String toString() {
        return variable + "=" + replacement.toPrefix();
    }
}
