package org.rholang.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.CharStreams;

/**
 * Command line driver:
 *
 * <pre>
 * rholang parse  [-f FILENAME | -s SRC] [--pretty] [-q]
 * rholang check  [-f FILENAME | -s SRC] [-q]
 * rholang format [-f FILENAME | -s SRC] [-q]
 * rholang tree   [-f FILENAME | -s SRC] [-q]
 * </pre>
 *
 * Without -f or -s the program is read from standard input.
 */
public class Rholang {
    static final int EX_USAGE = 1;
    static final int EX_DATAERR = 65;

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void main(String[] args) throws IOException {
        int status = run(args, System.in, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) throws IOException {
        if (args.length == 0) {
            usage(err);
            return EX_USAGE;
        }
        String command = args[0];
        String fname = null;
        String src = null;
        boolean prettyJson = false;
        boolean quiet = false;
        int i = 1;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length) {
                fname = args[i+1];
                i = i + 2;
            } else if (args[i].equals("-s") && i + 1 < args.length) {
                src = args[i+1];
                i = i + 2;
            } else if (args[i].equals("--pretty")) {
                prettyJson = true;
                i++;
            } else if (args[i].equals("-q")) {
                quiet = true;
                i++;
            } else {
                usage(err);
                return EX_USAGE;
            }
        }

        if (src == null) {
            if (fname != null) {
                byte[] bytes = Files.readAllBytes(Paths.get(fname));
                src = new String(bytes, StandardCharsets.UTF_8);
            } else {
                src = CharStreams.toString(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        }

        ParseReport report;
        switch (command) {
            case "parse":
                try {
                    report = ParseReport.success(RholangParser.toTreeString(src));
                } catch (ParserError e) {
                    if (!quiet) error(err, e);
                    report = ParseReport.failure(e);
                }
                writeJson(report, prettyJson, out);
                return 0;
            case "check":
                try {
                    RholangParser.parse(src);
                    report = new ParseReport(true, null, null);
                } catch (ParserError e) {
                    if (!quiet) error(err, e);
                    report = ParseReport.failure(e);
                }
                writeJson(report, prettyJson, out);
                return 0;
            case "format":
                try {
                    out.println(RholangParser.toCanonicalString(RholangParser.parse(src)));
                } catch (ParserError e) {
                    if (!quiet) error(err, e);
                    return EX_DATAERR;
                }
                return 0;
            case "tree":
                try {
                    out.println(RholangParser.toPrettyTree(src));
                } catch (ParserError e) {
                    if (!quiet) error(err, e);
                    return EX_DATAERR;
                }
                return 0;
            default:
                usage(err);
                return EX_USAGE;
        }
    }

    static void error(PrintStream err, ParserError error) {
        err.println("[line " + error.getLine() + ", column " + error.getColumn() +
            "] Error: " + error.getMessage());
    }

    private static void writeJson(ParseReport report, boolean pretty, PrintStream out) throws IOException {
        if (pretty) {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } else {
            out.println(mapper.writeValueAsString(report));
        }
    }

    private static void usage(PrintStream err) {
        err.println("Usage: rholang (parse|check|format|tree) [-f FILENAME | -s SRC] [--pretty] [-q]");
    }
}
