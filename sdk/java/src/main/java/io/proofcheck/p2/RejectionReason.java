package io.proofcheck.p2;

/**
 * Why a proof was not checked line by line.
 */
public enum RejectionReason {
    MISSING_LINE_NUMBER(true),
    MISSING_FORMULA(true),
    NON_CONSECUTIVE_LINE_NUMBERS(true),
    EMPTY_PROOF(true),
    NOT_A_WFF(false),
    CAPACITY_EXCEEDED(false),
    INTERNAL(false);

    private final boolean structural;

    RejectionReason(boolean structural) {
        this.structural = structural;
    }

    /** True for line-structure problems, false for formula syntax and internal failures. */
    public boolean isStructural() {
        return structural;
    }
}
