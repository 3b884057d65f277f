package org.grapl.engine.repl;

import org.grapl.engine.resolve.ResolverConfig;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Command line options of the Grapl REPL.
 * 
 * <pre>
 * grapl [--no-shadowing] [--recursion] [--dot] [--history FILE] [PROGRAM_FILE]
 * </pre>
 * 
 * @param config      Binding policy; shadowing is on unless --no-shadowing
 * @param dot         Print DOT instead of canonical text for program files
 * @param historyFile History location, when overridden
 * @param programFile Program to evaluate in batch mode, when given
 * @param help        Print usage and exit
 */
public record ReplOptions(
        ResolverConfig config,
        boolean dot,
        Optional<Path> historyFile,
        Optional<Path> programFile,
        boolean help) {

    public static final String USAGE = String.join("\n",
            "Usage: grapl [options] [program-file]",
            "",
            "Without a program file, starts an interactive session.",
            "",
            "Options:",
            "  --no-shadowing   Reject rebinding an already bound name",
            "  --recursion      Accept bindings that refer to their own name",
            "  --dot            Print the program's graph in Graphviz DOT format",
            "  --history FILE   Read and write line history from FILE",
            "  --help           Print this message");

    /**
     * Parses command line arguments.
     * 
     * @throws IllegalArgumentException on an unknown option or a missing value
     */
    public static ReplOptions parse(String... args) {
        boolean shadowing = true;
        boolean recursion = false;
        boolean dot = false;
        boolean help = false;
        Path history = null;
        Path program = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--no-shadowing" -> shadowing = false;
                case "--recursion" -> recursion = true;
                case "--dot" -> dot = true;
                case "--help", "-h" -> help = true;
                case "--history" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for --history");
                    }
                    history = Path.of(args[++i]);
                }
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (program != null) {
                        throw new IllegalArgumentException("Only one program file may be given");
                    }
                    program = Path.of(arg);
                }
            }
        }

        ResolverConfig config = ResolverConfig.defaults();
        if (shadowing) {
            config = config.withShadowing();
        }
        if (recursion) {
            config = config.withRecursion();
        }
        return new ReplOptions(config, dot, Optional.ofNullable(history), Optional.ofNullable(program), help);
    }
}
