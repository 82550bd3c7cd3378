package io.proofcheck.p2;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level proof verification: ingest, parse every formula, then check each line's justification.
 * A checker keeps no state between calls and may be shared between threads.
 */
public final class ProofChecker {
    private static final Logger log = LoggerFactory.getLogger(ProofChecker.class);

    private final CheckerConfig config;

    public ProofChecker() {
        this(new CheckerConfig());
    }

    public ProofChecker(CheckerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Verify with default settings. */
    public static VerificationResult check(String proofText) {
        return new ProofChecker().verify(proofText);
    }

    /**
     * Verify a whole proof. Never throws for bad input: structure and syntax problems give
     * {@link Verdict#REJECTED}, limits and unexpected failures give {@link Verdict#INTERNAL_ERROR}.
     */
    public VerificationResult verify(String proofText) {
        Objects.requireNonNull(proofText, "proofText");
        try {
            Context ctx = new Context(new WffParser(config.maxFormulaDepth));
            Proof proof = new ProofReader(config.maxLines).read(proofText);
            ctx.proof = parseFormulas(proof, ctx.parser);
            VerificationResult result = checkLines(ctx);
            log.debug("verified {} lines: {}", proof.size(), result.verdict());
            return result;
        } catch (StructureException e) {
            log.debug("proof rejected ({}): {}", e.reason(), e.getMessage());
            return VerificationResult.rejected(e.reason(), e.getMessage());
        } catch (WffSyntaxException e) {
            log.debug("proof rejected (NOT_A_WFF): {}", e.getMessage());
            return VerificationResult.rejected(RejectionReason.NOT_A_WFF, e.getMessage());
        } catch (CapacityExceededException e) {
            log.warn("proof not checked: {}", e.getMessage());
            return VerificationResult.internalError(RejectionReason.CAPACITY_EXCEEDED, e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            log.error("proof checker failed", e);
            return VerificationResult.internalError(RejectionReason.INTERNAL, String.valueOf(e));
        }
    }

    private static Proof parseFormulas(Proof proof, WffParser parser) {
        List<ProofLine> parsed = new ArrayList<>(proof.size());
        for (ProofLine line : proof.lines()) {
            String text = line.formulaText().replaceAll("\\s+", "");
            Formula formula;
            try {
                formula = parser.parse(text);
            } catch (WffSyntaxException e) {
                throw new WffSyntaxException(e.position(),
                    "Line " + line.lineNumber() + ": formula is not a WFF: \"" + text + "\"");
            }
            parsed.add(new ProofLine(line.lineNumber(), text, formula, line.justification()));
        }
        return new Proof(parsed);
    }

    private VerificationResult checkLines(Context ctx) {
        for (ProofLine line : ctx.proof.lines()) {
            Justification just = Justification.parse(line.justification(), ctx.parser);
            RuleCheck check = checkLine(ctx.proof, line, just);
            LineResult result = new LineResult(line, just, check.ok(), check.reason());
            if (!check.ok()) {
                log.trace("line {} invalid: {} [{}]", line.lineNumber(), check.reason(), line.formula().toInfix());
            }
            ctx.results.add(result);
            ctx.report.append(result.reportLine()).append('\n');
        }
        return VerificationResult.checked(ctx.results, ctx.report.toString());
    }

    private RuleCheck checkLine(Proof proof, ProofLine line, Justification just) {
        if (just instanceof Justification.Premise) {
            return RuleCheck.pass();
        }
        if (just instanceof Justification.AxiomRef ax) {
            return ax.axiom().isInstance(line.formula())
                ? RuleCheck.pass()
                : RuleCheck.fail("not an instance of " + ax.axiom());
        }
        if (just instanceof Justification.ModusPonens mp) {
            return ModusPonensChecker.check(proof, line, mp.first(), mp.second(), config.citationScope);
        }
        if (just instanceof Justification.SubstitutionRule sub) {
            return SubstitutionChecker.check(proof, line, sub.substitution(), config.citationScope);
        }
        if (just instanceof Justification.Malformed bad) {
            return RuleCheck.fail(bad.reason());
        }
        return RuleCheck.fail("unknown justification");
    }

    /** Per-call state; never shared between calls. */
    private static final class Context {
        final WffParser parser;
        final StringBuilder report = new StringBuilder();
        final List<LineResult> results = new ArrayList<>();
        Proof proof;

        Context(WffParser parser) {
            this.parser = parser;
        }
    }
}
