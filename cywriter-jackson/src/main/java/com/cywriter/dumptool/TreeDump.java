package com.cywriter.dumptool;

import com.cywriter.CodeWriterException;
import com.cywriter.CyWriter;
import com.cywriter.ast.ModuleNode;
import com.cywriter.jackson.JacksonAstJsonProvider;
import com.cywriter.json.AstJsonDeserializer;
import com.cywriter.json.AstJsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads a code tree from a JSON file and prints it as Cython source.
 *
 * Usage:
 *   java -cp ... com.cywriter.dumptool.TreeDump [options] <tree.json>
 *
 * Options:
 *   --mode=code|pxd   Full source or declarations only (default: code)
 *   --output=PATH     Write to PATH instead of standard output
 *
 * Exit codes: 0 on success, 1 for bad arguments, 2 if the tree cannot be read or written.
 */
public class TreeDump {
    private static final Logger log = LoggerFactory.getLogger(TreeDump.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final AstJsonDeserializer deserializer;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        Config config = Config.parse(args, System.err);
        if (config == null) {
            printUsage(System.err);
            System.exit(EXIT_USAGE);
        }
        System.exit(new TreeDump(System.out, System.err).run(config));
    }

    public TreeDump(PrintStream out, PrintStream err) {
        this.deserializer = new JacksonAstJsonProvider().getDeserializer();
        this.out = out;
        this.err = err;
    }

    /**
     * @return the process exit code
     */
    public int run(Config config) {
        List<String> lines;
        try {
            String json = Files.readString(config.input(), StandardCharsets.UTF_8);
            ModuleNode module = deserializer.deserializeModule(json);
            lines = config.mode() == Mode.PXD ? CyWriter.writeDeclarations(module) : CyWriter.writeCode(module);
        } catch (IOException e) {
            err.println("Cannot read " + config.input() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (AstJsonException | CodeWriterException e) {
            err.println(config.input() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        log.debug("Wrote {} lines for {}", lines.size(), config.input());

        if (config.output() == null) {
            lines.forEach(out::println);
            return EXIT_OK;
        }
        try {
            Files.write(config.output(), lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot write " + config.output() + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: TreeDump [options] <tree.json>");
        stream.println();
        stream.println("Options:");
        stream.println("  --mode=code|pxd   Full source or declarations only (default: code)");
        stream.println("  --output=PATH     Write to PATH instead of standard output");
        stream.println("  --help            Show this help");
    }

    // ========== Inner classes ==========

    public enum Mode {
        CODE, PXD
    }

    /**
     * Parsed command line.
     *
     * @param output can be null for standard output
     */
    public record Config(Mode mode, Path output, Path input) {

        /**
         * @return the configuration, or null after reporting a problem to {@code err}
         */
        public static Config parse(String[] args, PrintStream err) {
            Mode mode = Mode.CODE;
            Path output = null;
            Path input = null;

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--mode=")) {
                    String value = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        mode = Mode.valueOf(value);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid mode: " + arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--output=")) {
                    output = Path.of(arg.substring(9));
                } else if (!arg.startsWith("-")) {
                    if (input != null) {
                        err.println("Error: More than one input file");
                        return null;
                    }
                    input = Path.of(arg);
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (input == null) {
                err.println("Error: No input file specified");
                return null;
            }
            return new Config(mode, output, input);
        }
    }
}
