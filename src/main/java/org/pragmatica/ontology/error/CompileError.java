package org.pragmatica.ontology.error;

import org.pragmatica.ontology.tree.SourceLocation;
import org.pragmatica.ontology.tree.SourceSpan;

/**
 * Failure to compile DSL source text. There are exactly two kinds: the lexer rejected a
 * character ({@link LexicalError}), or the parser met a token it did not expect
 * ({@link SyntaxError}). Compilation stops at the first one.
 */
public abstract sealed class CompileError extends RuntimeException permits LexicalError, SyntaxError {
    private final SourceSpan span;

    protected CompileError(String reason, SourceSpan span) {
        super(reason + " at " + span.start());
        this.span = span;
    }

    public SourceSpan span() {
        return span;
    }

    public SourceLocation location() {
        return span.start();
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    /**
     * Message without the trailing location.
     */
    public abstract String reason();

    /**
     * Short error code shown in rendered diagnostics.
     */
    public abstract String code();

    public Diagnostic toDiagnostic() {
        return Diagnostic.error(code(), reason(), span);
    }
}
