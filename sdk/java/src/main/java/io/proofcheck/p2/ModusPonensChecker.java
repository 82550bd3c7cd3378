package io.proofcheck.p2;

/**
 * From {@code A} and {@code c A B}, infer {@code B}. The two citations may come in either order.
 */
public final class ModusPonensChecker {
    private ModusPonensChecker() {}

    public static RuleCheck check(Proof proof, ProofLine current, int first, int second, CitationScope scope) {
        if (!proof.contains(first) || !proof.contains(second)) {
            return RuleCheck.fail("cited line out of range 1.." + proof.size());
        }
        if (!scope.allows(first, current.lineNumber()) || !scope.allows(second, current.lineNumber())) {
            return RuleCheck.fail("MP may only cite earlier lines");
        }
        Formula a = proof.line(first).formula();
        Formula b = proof.line(second).formula();
        if (follows(a, b, current.formula()) || follows(b, a, current.formula())) {
            return RuleCheck.pass();
        }
        return RuleCheck.fail("lines " + first + " and " + second + " do not yield this formula by MP");
    }

    /** True iff {@code major} is {@code c minor conclusion}. */
    public static boolean follows(Formula minor, Formula major, Formula conclusion) {
        return major instanceof Formula.Implies imp
            && Formula.equal(minor, imp.left())
            && Formula.equal(conclusion, imp.right());
    }
}
