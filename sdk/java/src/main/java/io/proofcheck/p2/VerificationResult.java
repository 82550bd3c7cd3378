package io.proofcheck.p2;

import java.util.List;

/**
 * Report and verdict of one {@link ProofChecker#verify} call.
 * {@code reason} is set only for {@link Verdict#REJECTED} and {@link Verdict#INTERNAL_ERROR};
 * {@code lines} is empty unless the proof reached the checking phase.
 */
public record VerificationResult(Verdict verdict, RejectionReason reason, String report, List<LineResult> lines) {
    public VerificationResult {
        lines = List.copyOf(lines);
    }

    static VerificationResult checked(List<LineResult> lines, String report) {
        boolean allOk = lines.stream().allMatch(LineResult::ok);
        return new VerificationResult(allOk ? Verdict.VALID : Verdict.INVALID, null, report, lines);
    }

    static VerificationResult rejected(RejectionReason reason, String message) {
        return new VerificationResult(Verdict.REJECTED, reason, message + "\n", List.of());
    }

    static VerificationResult internalError(RejectionReason reason, String message) {
        return new VerificationResult(Verdict.INTERNAL_ERROR, reason, "Internal error: " + message + "\n", List.of());
    }

    public boolean isValid() {
        return verdict == Verdict.VALID;
    }

    public int exitCode() {
        return verdict.exitCode();
    }
}
