package org.grapl.engine.repl;

import org.grapl.dsl.GraplParseException;
import org.grapl.engine.resolve.GraplResolveException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: an interactive session, or batch evaluation of a
 * program file.
 * 
 * Usage: grapl [options] [program-file]
 */
public final class GraplRepl {

    private static final String PROMPT = "> ";

    private GraplRepl() {
    }

    public static void main(String[] args) {
        ReplOptions options;
        try {
            options = ReplOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ReplOptions.USAGE);
            System.exit(2);
            return;
        }

        if (options.help()) {
            System.out.println(ReplOptions.USAGE);
            return;
        }

        if (options.programFile().isPresent()) {
            System.exit(runFile(options.programFile().get(), options));
            return;
        }
        interactive(options);
    }

    private static int runFile(Path file, ReplOptions options) {
        ReplSession session = new ReplSession(options.config(), System.out);
        try {
            session.runProgram(Files.readString(file, StandardCharsets.UTF_8), options.dot());
            return 0;
        } catch (IOException e) {
            System.err.println("Cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (GraplParseException | GraplResolveException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void interactive(ReplOptions options) {
        HistoryFile history = options.historyFile()
                .map(HistoryFile::new)
                .orElseGet(HistoryFile::forCurrentUser);
        try {
            history.load();
        } catch (IOException e) {
            System.err.println("Could not load history from " + history.path() + ": " + e.getMessage());
        }

        ReplSession session = new ReplSession(options.config(), System.out);
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            while (true) {
                System.out.print(PROMPT);
                System.out.flush();
                String line = reader.readLine();
                if (line == null) {
                    System.out.println();
                    System.out.println("End of input. Exiting.");
                    break;
                }
                if (session.evaluate(line)) {
                    history.add(line);
                }
            }
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
        }

        try {
            history.save();
        } catch (IOException e) {
            System.err.println("Could not save history to " + history.path() + ": " + e.getMessage());
        }
    }
}
