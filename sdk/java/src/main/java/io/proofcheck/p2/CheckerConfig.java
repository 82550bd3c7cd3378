package io.proofcheck.p2;

/**
 * Settings for a {@link ProofChecker}.
 */
public class CheckerConfig {
    public CitationScope citationScope = CitationScope.WHOLE_PROOF;
    public int maxFormulaDepth = 4096;
    public int maxLines = 100_000;
}
