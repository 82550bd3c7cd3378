package io.proofcheck.p2;

/**
 * A line is justified by substitution when some citable line becomes it under the substitution.
 */
public final class SubstitutionChecker {
    private SubstitutionChecker() {}

    public static RuleCheck check(Proof proof, ProofLine current, Substitution substitution, CitationScope scope) {
        for (ProofLine source : proof.lines()) {
            if (!scope.allows(source.lineNumber(), current.lineNumber())) continue;
            if (source.formula() == null) continue;
            if (substitution.yields(source.formula(), current.formula())) {
                return RuleCheck.pass();
            }
        }
        return RuleCheck.fail("no line yields this formula by substituting " + substitution);
    }
}
