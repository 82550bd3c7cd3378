package io.proofcheck.p2;

/**
 * A configured limit (formula nesting, line count) was hit.
 */
public class CapacityExceededException extends ProofException {
    public CapacityExceededException(String message) {
        super(message);
    }
}
