package io.proofcheck.p2;

/**
 * Outcome of parsing one formula from a position in a string.
 */
public sealed interface ParseResult {
    /** Parsed formula and the offset just past it. */
    record Success(Formula formula, int position) implements ParseResult {}

    /** Offset where parsing failed and why. */
    record Failure(int position, String reason) implements ParseResult {}

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
