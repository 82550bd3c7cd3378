package io.proofcheck.p2;

import java.util.List;

/**
 * Lines numbered 1..N in order.
 */
public final class Proof {
    private final List<ProofLine> lines;

    public Proof(List<ProofLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).lineNumber() != i + 1) {
                throw new IllegalArgumentException("line " + (i + 1) + " is numbered " + lines.get(i).lineNumber());
            }
        }
        this.lines = List.copyOf(lines);
    }

    public List<ProofLine> lines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean contains(int lineNumber) {
        return lineNumber >= 1 && lineNumber <= lines.size();
    }

    /** 1-based. */
    public ProofLine line(int lineNumber) {
        if (!contains(lineNumber)) {
            throw new IndexOutOfBoundsException("no line " + lineNumber + " in a proof of " + lines.size());
        }
        return lines.get(lineNumber - 1);
    }
}
