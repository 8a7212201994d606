package org.pragmatica.ontology;

import org.pragmatica.ontology.dsl.DslLexer;
import org.pragmatica.ontology.dsl.DslParser;
import org.pragmatica.ontology.dsl.DslToken;
import org.pragmatica.ontology.dsl.Program;
import org.pragmatica.ontology.error.CompileError;
import org.pragmatica.ontology.generator.CompilerConfig;
import org.pragmatica.ontology.generator.CypherGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for compiling ontology DSL source into Cypher.
 *
 * <p>Example usage:
 * <pre>{@code
 * var cypher = OntologyCompiler.compile("""
 *     LOAD_CSV "level1.csv" AS measurement
 *       MAP_COLUMNS { factory -> factory_id, product -> product_id }
 *     """);
 * }</pre>
 *
 * <p>Compilation works on in-memory text only and is deterministic: the same source always
 * yields the same output. Any {@link CompileError} aborts the whole compilation.
 */
public final class OntologyCompiler {
    private static final Logger logger = LoggerFactory.getLogger(OntologyCompiler.class);

    private OntologyCompiler() {}

    /**
     * Split source text into tokens. Source longer than the configured limit is a
     * {@link org.pragmatica.ontology.error.LexicalError}.
     */
    public static List<DslToken> tokenize(String source) {
        return tokenize(source, CompilerConfig.DEFAULT);
    }

    public static List<DslToken> tokenize(String source, CompilerConfig config) {
        var tokens = DslLexer.tokenize(source, config.maxInputSize());
        logger.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    /**
     * Parse source text into a program.
     */
    public static Program parse(String source) {
        return parse(source, CompilerConfig.DEFAULT);
    }

    public static Program parse(String source, CompilerConfig config) {
        var program = DslParser.parse(tokenize(source, config));
        logger.debug("Parsed {} statements", program.size());
        return program;
    }

    /**
     * Compile source text into Cypher query text.
     *
     * @throws CompileError on the first lexical or syntax error
     */
    public static String compile(String source) {
        return compile(source, CompilerConfig.DEFAULT);
    }

    public static String compile(String source, CompilerConfig config) {
        return CypherGenerator.create(config)
                              .generate(parse(source, config));
    }

    /**
     * Compile source text into one Cypher block per statement, in statement order.
     */
    public static List<String> compileBlocks(String source) {
        return compileBlocks(source, CompilerConfig.DEFAULT);
    }

    public static List<String> compileBlocks(String source, CompilerConfig config) {
        return CypherGenerator.create(config)
                              .generateBlocks(parse(source, config));
    }
}
