package io.proofcheck.p2;

/**
 * Which lines modus ponens and substitution may cite.
 */
public enum CitationScope {
    /** Any line of the proof, including later lines and the line being checked. */
    WHOLE_PROOF,
    /** Only lines strictly before the line being checked. */
    PRECEDING_LINES;

    boolean allows(int cited, int current) {
        return this == WHOLE_PROOF || cited < current;
    }
}
