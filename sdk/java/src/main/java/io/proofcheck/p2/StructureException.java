package io.proofcheck.p2;

/**
 * Proof text whose line structure cannot be ingested: missing number, missing formula,
 * broken numbering or no lines at all.
 */
public class StructureException extends ProofException {
    private final RejectionReason reason;

    public StructureException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason reason() {
        return reason;
    }
}
