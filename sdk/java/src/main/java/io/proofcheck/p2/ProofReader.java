package io.proofcheck.p2;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits proof text into numbered lines of the form {@code <n> <formula> <justification>}.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public final class ProofReader {
    private final int maxLines;

    public ProofReader(int maxLines) {
        this.maxLines = maxLines;
    }

    /**
     * @throws StructureException on a malformed line, broken numbering or an empty proof
     * @throws CapacityExceededException if there are more than {@code maxLines} lines
     */
    public Proof read(String text) {
        List<ProofLine> lines = new ArrayList<>();
        int expected = 1;
        for (String raw : text.split("\n", -1)) {
            String line = raw.stripLeading();
            if (line.isEmpty() || line.startsWith("#")) continue;

            ProofLine parsed = readLine(raw, line);
            if (parsed.lineNumber() != expected) {
                throw new StructureException(RejectionReason.NON_CONSECUTIVE_LINE_NUMBERS,
                    "Line numbers must be consecutive starting at 1 (expected " + expected
                        + " but got " + parsed.lineNumber() + ")");
            }
            if (lines.size() >= maxLines) {
                throw new CapacityExceededException("proof has more than " + maxLines + " lines");
            }
            lines.add(parsed);
            expected++;
        }
        if (lines.isEmpty()) {
            throw new StructureException(RejectionReason.EMPTY_PROOF, "No proof lines read.");
        }
        return new Proof(lines);
    }

    private static ProofLine readLine(String raw, String line) {
        int pos = 0;
        if (pos < line.length() && (line.charAt(pos) == '+' || line.charAt(pos) == '-')) pos++;
        int digitsStart = pos;
        while (pos < line.length() && line.charAt(pos) >= '0' && line.charAt(pos) <= '9') pos++;
        if (pos == digitsStart || (pos < line.length() && !Character.isWhitespace(line.charAt(pos)))) {
            throw missingNumber(raw);
        }
        int lineNumber;
        try {
            lineNumber = Integer.parseInt(line.substring(0, pos));
        } catch (NumberFormatException e) {
            throw missingNumber(raw);
        }

        int start = WffParser.skipWhitespace(line, pos);
        if (start >= line.length()) {
            throw new StructureException(RejectionReason.MISSING_FORMULA, "Missing formula on line " + lineNumber);
        }
        int end = start;
        while (end < line.length() && !Character.isWhitespace(line.charAt(end))) end++;
        String formulaText = line.substring(start, end);
        String justification = line.substring(end).trim();
        return new ProofLine(lineNumber, formulaText, null, justification);
    }

    private static StructureException missingNumber(String raw) {
        return new StructureException(RejectionReason.MISSING_LINE_NUMBER,
            "Bad input line (missing line number): " + raw.strip());
    }
}
