package org.pragmatica.ontology.generator;

import org.pragmatica.ontology.dsl.DslLexer;

import java.util.Objects;

/**
 * Compiler configuration options.
 *
 * @param maxInputSize      largest accepted source text, in characters
 * @param csvLocationPrefix prepended to {@code LOAD_CSV} paths to form the CSV URL
 * @param blockSeparator    text placed between the blocks of consecutive statements
 */
public record CompilerConfig(
    int maxInputSize,
    String csvLocationPrefix,
    String blockSeparator
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        DslLexer.MAX_INPUT_SIZE,
        "file:///",
        "\n\n"
    );

    public CompilerConfig {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive: " + maxInputSize);
        }
        Objects.requireNonNull(csvLocationPrefix, "csvLocationPrefix");
        Objects.requireNonNull(blockSeparator, "blockSeparator");
    }

    public CompilerConfig withCsvLocationPrefix(String prefix) {
        return new CompilerConfig(maxInputSize, prefix, blockSeparator);
    }

    public CompilerConfig withMaxInputSize(int size) {
        return new CompilerConfig(size, csvLocationPrefix, blockSeparator);
    }
}
