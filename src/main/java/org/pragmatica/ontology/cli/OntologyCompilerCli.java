package org.pragmatica.ontology.cli;

import org.pragmatica.ontology.OntologyCompiler;
import org.pragmatica.ontology.error.CompileError;
import org.pragmatica.ontology.generator.CypherGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Command-line front end: reads a DSL file, compiles it and writes the Cypher text to
 * stdout or to a file.
 *
 * <pre>
 * ontology-dsl &lt;input.dsl&gt; [-o|--output &lt;file.cypher&gt;] [--version] [--help]
 * </pre>
 */
public final class OntologyCompilerCli {
    private static final Logger logger = LoggerFactory.getLogger(OntologyCompilerCli.class);

    static final String VERSION = "Dynamic Ontology DSL Compiler v1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String BANNER_RULE = "=".repeat(60);

    private static final String USAGE = """
        Usage: ontology-dsl <input.dsl> [-o|--output <file.cypher>]
               ontology-dsl --version

        Compiles an ontology DSL file to Cypher. Output goes to stdout unless -o is given.
        """;

    private OntologyCompilerCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the compiler with the given arguments.
     *
     * @return process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Path input = null;
        Path output = null;

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "--version" -> {
                    out.println(VERSION);
                    return EXIT_OK;
                }
                case "-h", "--help" -> {
                    out.print(USAGE);
                    return EXIT_OK;
                }
                case "-o", "--output" -> {
                    if (i + 1 >= args.length) {
                        err.println("Error: " + arg + " requires a file argument");
                        err.print(USAGE);
                        return EXIT_USAGE;
                    }
                    output = Path.of(args[++i]);
                }
                default -> {
                    if (arg.startsWith("-") || input != null) {
                        err.println("Error: unexpected argument: " + arg);
                        err.print(USAGE);
                        return EXIT_USAGE;
                    }
                    input = Path.of(arg);
                }
            }
        }

        if (input == null) {
            err.print(USAGE);
            return EXIT_USAGE;
        }
        return compileFile(input, output, out, err);
    }

    private static int compileFile(Path input, Path output, PrintStream out, PrintStream err) {
        String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            err.println("Error: File not found: " + input);
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return EXIT_FAILURE;
        }

        String cypher;
        try {
            logger.info("Parsing {}", input);
            var program = OntologyCompiler.parse(source);
            logger.info("Parsed {} statements", program.size());
            logger.info("Generating Cypher code...");
            cypher = CypherGenerator.create().generate(program);
            logger.info("Cypher code generated");
        } catch (CompileError e) {
            err.print(e.toDiagnostic().format(source, input.toString()));
            return EXIT_FAILURE;
        }

        if (output == null) {
            logger.info(BANNER_RULE);
            logger.info("Generated Cypher Code:");
            logger.info(BANNER_RULE);
            out.println(cypher);
            return EXIT_OK;
        }
        try {
            Files.writeString(output, cypher, StandardCharsets.UTF_8);
            logger.info("Written to {}", output);
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Error writing output file: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
