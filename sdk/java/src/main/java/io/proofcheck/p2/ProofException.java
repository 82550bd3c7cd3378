package io.proofcheck.p2;

/**
 * Base unchecked exception for proof-checker failures.
 */
public class ProofException extends RuntimeException {
    public ProofException(String message) {
        super(message);
    }
}
