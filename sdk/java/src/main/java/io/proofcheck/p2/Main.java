package io.proofcheck.p2;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line checker: reads a proof from a file (or stdin), prints the report and exits with
 * 0 (valid), 1 (invalid line), 2 (rejected), 3 (internal error) or 64 (usage).
 */
public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int USAGE = 64;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        CheckerConfig config = new CheckerConfig();
        String source = "-";
        boolean verbose = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--forward-only" -> config.citationScope = CitationScope.PRECEDING_LINES;
                case "-v", "--verbose" -> verbose = true;
                case "--max-depth" -> {
                    if (i + 1 >= args.length) return usage(err, "--max-depth needs a value");
                    try {
                        config.maxFormulaDepth = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        return usage(err, "bad --max-depth: " + args[i]);
                    }
                    if (config.maxFormulaDepth < 1) return usage(err, "--max-depth must be positive");
                }
                case "-h", "--help" -> {
                    printUsage(out);
                    return 0;
                }
                default -> {
                    if (args[i].startsWith("--")) return usage(err, "unknown option " + args[i]);
                    source = args[i];
                }
            }
        }

        String proofText;
        try {
            proofText = source.equals("-")
                ? new String(stdin.readAllBytes(), StandardCharsets.UTF_8)
                : Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("cannot read proof from {}", source, e);
            err.println("Error: cannot read " + source + ": " + e.getMessage());
            return Verdict.INTERNAL_ERROR.exitCode();
        }

        log.info("Checking proof from {}", source.equals("-") ? "stdin" : source);
        VerificationResult result = new ProofChecker(config).verify(proofText);
        if (verbose && !result.lines().isEmpty()) {
            for (LineResult line : result.lines()) {
                if (!line.ok()) out.println(line.diagnosticLine());
                out.println(line.reportLine());
            }
        } else {
            out.print(result.report());
        }
        out.flush();
        log.info("Verdict: {}", result.verdict());
        return result.exitCode();
    }

    private static int usage(PrintStream err, String problem) {
        err.println("Error: " + problem);
        printUsage(err);
        return USAGE;
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: java -jar p2-proof-checker.jar [--forward-only] [--verbose] [--max-depth N] [proof-file|-]");
        ps.println("Each proof line: <n> <formula> <justification>");
        ps.println("Justifications: Premise, AX1, AX2, AX3, MP i j, Substitution V=<formula>");
    }
}
