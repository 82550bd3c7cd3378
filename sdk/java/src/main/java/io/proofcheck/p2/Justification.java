package io.proofcheck.p2;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classified justification of a proof line. Keywords are case-insensitive.
 */
public sealed interface Justification {
    record Premise() implements Justification {}
    record AxiomRef(Axiom axiom) implements Justification {}
    record ModusPonens(int first, int second) implements Justification {}
    record SubstitutionRule(Substitution substitution) implements Justification {}

    /** Known keyword with arguments that cannot be used. */
    record Malformed(String keyword, String reason) implements Justification {}

    record Unknown(String text) implements Justification {}

    String MP = "MP";
    String SUBSTITUTION = "Substitution";

    Pattern MP_ARGS = Pattern.compile("\\s*([+-]?\\d+)\\s+([+-]?\\d+).*", Pattern.DOTALL);

    static Justification parse(String text, WffParser parser) {
        if (text == null) return new Unknown("");
        String just = text.trim();
        if (just.equalsIgnoreCase("Premise")) return new Premise();

        Optional<Axiom> axiom = Axiom.named(just);
        if (axiom.isPresent()) return new AxiomRef(axiom.get());
        if (just.regionMatches(true, 0, MP, 0, MP.length())) {
            return parseModusPonens(just.substring(MP.length()));
        }
        if (just.regionMatches(true, 0, SUBSTITUTION, 0, SUBSTITUTION.length())) {
            return parseSubstitution(just.substring(SUBSTITUTION.length()), parser);
        }
        return new Unknown(just);
    }

    private static Justification parseModusPonens(String args) {
        Matcher m = MP_ARGS.matcher(args);
        if (!m.matches()) return new Malformed(MP, "bad MP justification format");
        try {
            return new ModusPonens(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (NumberFormatException e) {
            return new Malformed(MP, "MP line number out of range: " + e.getMessage());
        }
    }

    private static Justification parseSubstitution(String args, WffParser parser) {
        try {
            return Substitution.parse(args, parser)
                .<Justification>map(SubstitutionRule::new)
                .orElseGet(() -> new Malformed(SUBSTITUTION, "bad substitution format, expected <Var>=<WFF>"));
        } catch (WffSyntaxException e) {
            return new Malformed(SUBSTITUTION, "replacement is not a WFF");
        }
    }
}
