package io.proofcheck.p2;

/**
 * Text that is not a well-formed formula.
 */
public class WffSyntaxException extends ProofException {
    private final int position;

    public WffSyntaxException(int position, String message) {
        super(message);
        this.position = position;
    }

    /** Offset in the parsed text where parsing gave up. */
    public int position() {
        return position;
    }
}
