package io.proofcheck.p2;

/**
 * Result of applying one inference rule to one line.
 */
public record RuleCheck(boolean ok, String reason) {
    private static final RuleCheck PASS = new RuleCheck(true, null);

    public static RuleCheck pass() { return PASS; }
    public static RuleCheck fail(String reason) { return new RuleCheck(false, reason); }
}
