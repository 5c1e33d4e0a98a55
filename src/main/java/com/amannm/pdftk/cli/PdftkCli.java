package com.amannm.pdftk.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amannm.pdftk.PdftkException;
import com.amannm.pdftk.mcp.PdftkMcpServer;
import com.amannm.pdftk.operation.PdfOperations;

/**
 * Command line entry point: {@code pdftk <burst|cat|rotate|shuffle|serve> ...}.
 * <p>
 * Exits with 0 on success and 1 on any error, after printing a single {@code Error:} line to stderr.
 */
public class PdftkCli {

    private static final Logger log = LoggerFactory.getLogger(PdftkCli.class);

    static final String VERSION = "1.0.0";

    private static class Cli {
        String operation;
        final List<String> inputs = new ArrayList<>();
        String output;
        List<String> ranges;     // null when -r was not given
        String pattern = PdfOperations.DEFAULT_BURST_PATTERN;
        String dir = PdfOperations.DEFAULT_BURST_DIR.toString();
        boolean help = false;
    }

    private final PdfOperations operations;
    private final PrintStream out;
    private final PrintStream err;

    public PdftkCli(PdfOperations operations, PrintStream out, PrintStream err) {
        this.operations = operations;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new PdftkCli(new PdfOperations(), System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command.
     *
     * @return the process exit status
     */
    public int run(String[] args) {
        Cli cli;
        try {
            cli = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return 1;
        }
        if (cli.help) {
            printUsage(out);
            return 0;
        }
        if ("--version".equals(cli.operation)) {
            out.println("pdftk " + VERSION);
            return 0;
        }

        try {
            execute(cli);
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return 1;
        } catch (PdftkException e) {
            log.debug("{} failed", cli.operation, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.debug("{} failed", cli.operation, e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("{} failed", cli.operation, e);
            err.println("Unexpected error: " + e.getMessage());
            return 1;
        }
    }

    private void execute(Cli cli) throws IOException {
        switch (cli.operation) {
            case "burst" -> {
                String input = single(cli);
                List<Path> files = operations.burst(Path.of(input), cli.pattern, Path.of(cli.dir));
                out.println("Successfully split " + files.size() + " pages from " + input);
            }
            case "cat" -> {
                requireInputs(cli);
                operations.cat(cli.inputs, cli.ranges == null ? List.of() : cli.ranges, requireOutput(cli));
                out.println("Successfully created " + cli.output);
            }
            case "rotate" -> {
                String input = single(cli);
                operations.rotate(input, requireRanges(cli), requireOutput(cli));
                out.println("Successfully created " + cli.output);
            }
            case "shuffle" -> {
                requireInputs(cli);
                operations.shuffle(cli.inputs, requireRanges(cli), requireOutput(cli));
                out.println("Successfully created " + cli.output);
            }
            case "serve" -> PdftkMcpServer.serve();
            default -> throw new IllegalArgumentException("Unknown operation: " + cli.operation);
        }
    }

    private static Cli parseArgs(String[] args) {
        Cli cli = new Cli();
        if (args.length == 0) {
            throw new IllegalArgumentException("Missing operation.");
        }
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h":
                case "--help":
                    cli.help = true;
                    return cli;
                case "--version":
                    cli.operation = a;
                    return cli;
                case "-o":
                case "--output":
                    cli.output = requireValue(a, args, ++i);
                    break;
                case "-r":
                case "--ranges":
                    cli.ranges = new ArrayList<>();
                    while (i + 1 < args.length && !isOption(args[i + 1])) {
                        cli.ranges.add(args[++i]);
                    }
                    break;
                case "-p":
                case "--pattern":
                    cli.pattern = requireValue(a, args, ++i);
                    break;
                case "-d":
                case "--dir":
                    cli.dir = requireValue(a, args, ++i);
                    break;
                default:
                    if (isOption(a)) {
                        throw new IllegalArgumentException("Unknown option: " + a);
                    }
                    if (cli.operation == null) {
                        cli.operation = a;
                    } else {
                        cli.inputs.add(a);
                    }
            }
        }
        if (cli.operation == null) {
            throw new IllegalArgumentException("Missing operation.");
        }
        return cli;
    }

    private static boolean isOption(String arg) {
        return arg.startsWith("-") && arg.length() > 1;
    }

    private static String requireValue(String opt, String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + opt);
        }
        return args[index];
    }

    private static String single(Cli cli) {
        if (cli.inputs.size() != 1) {
            throw new IllegalArgumentException(cli.operation + " takes exactly one input file.");
        }
        return cli.inputs.get(0);
    }

    private static void requireInputs(Cli cli) {
        if (cli.inputs.isEmpty()) {
            throw new IllegalArgumentException(cli.operation + " needs at least one input file.");
        }
    }

    private static Path requireOutput(Cli cli) {
        if (cli.output == null) {
            throw new IllegalArgumentException(cli.operation + " requires -o/--output.");
        }
        return Path.of(cli.output);
    }

    private static List<String> requireRanges(Cli cli) {
        if (cli.ranges == null || cli.ranges.isEmpty()) {
            throw new IllegalArgumentException(cli.operation + " requires -r/--ranges.");
        }
        return cli.ranges;
    }

    private static void printUsage(PrintStream out) {
        out.println("pdftk - select, reorder, rotate and interleave PDF pages");
        out.println();
        out.println("Usage:");
        out.println("  pdftk burst INPUT [-p PATTERN] [-d DIR]");
        out.println("  pdftk cat INPUT... -o OUTPUT [-r RANGE...]");
        out.println("  pdftk rotate INPUT -o OUTPUT -r RANGE...");
        out.println("  pdftk shuffle INPUT... -o OUTPUT -r RANGE...");
        out.println("  pdftk serve");
        out.println();
        out.println("Options:");
        out.println("  -o, --output <path>     PDF file to create.");
        out.println("  -r, --ranges <range>... Page ranges; omitted in cat to merge every page.");
        out.println("  -p, --pattern <string>  burst file name pattern (default: " + PdfOperations.DEFAULT_BURST_PATTERN + ").");
        out.println("  -d, --dir <path>        burst output directory (default: current directory).");
        out.println("  -h, --help              Show this help and exit.");
        out.println("      --version           Show the version and exit.");
        out.println();
        out.println("Inputs are PDF paths, optionally named with a handle: A=first.pdf B=second.pdf.");
        out.println("Inputs without a handle are named A, B, C, ... in order.");
        out.println();
        out.println("Ranges:");
        out.println("  [HANDLE](PAGE|PAGE-PAGE)[even|odd][north|east|south|west|left|right|down], or a bare HANDLE");
        out.println("  PAGE is a number, end (last page), rend (first page) or rN (N-th page from the end).");
        out.println();
        out.println("Examples:");
        out.println("  pdftk cat A=a.pdf B=b.pdf -o out.pdf -r A1-3east B5 Bend-1odd");
        out.println("  pdftk rotate in.pdf -o out.pdf -r 1-5south 7-9west");
        out.println("  pdftk shuffle A=odd.pdf B=even.pdf -o out.pdf -r A Bend-1");
    }
}
