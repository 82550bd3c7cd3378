package io.proofcheck.p2;

/**
 * Outcome of a verification call.
 */
public enum Verdict {
    /** Every line checked OK. */
    VALID(0),
    /** All lines were checked and at least one is invalid. */
    INVALID(1),
    /** Structure or syntax problem; no line was checked. */
    REJECTED(2),
    /** A limit was exceeded or the checker failed unexpectedly. */
    INTERNAL_ERROR(3);

    private final int exitCode;

    Verdict(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
