package io.proofcheck.p2;

/**
 * One numbered line of a proof. {@code formula} is null until the formula text has been parsed.
 */
public record ProofLine(int lineNumber, String formulaText, Formula formula, String justification) {
    public boolean isParsed() {
        return formula != null;
    }
}
