package io.proofcheck.p2;

/**
 * Status of one checked line. {@code reason} is null when the line is OK.
 */
public record LineResult(ProofLine line, Justification justification, boolean ok, String reason) {
    public String reportLine() {
        return "Line " + line.lineNumber() + ": " + (ok ? "OK" : "INVALID") + ": "
            + line.formulaText() + "    [" + line.justification() + "]";
    }

    /** Why the line is invalid, e.g. {@code Line 2: unknown justification: "FooBar"}; null when OK. */
    public String diagnosticLine() {
        if (ok) return null;
        return "Line " + line.lineNumber() + ": " + reason + ": \"" + line.justification() + "\"";
    }
}
