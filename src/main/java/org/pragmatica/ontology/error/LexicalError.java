package org.pragmatica.ontology.error;

import org.pragmatica.ontology.tree.SourceSpan;

/**
 * The lexer could not turn the input at the given position into a token.
 */
public final class LexicalError extends CompileError {
    private final String reason;

    public LexicalError(String reason, SourceSpan span) {
        super(reason, span);
        this.reason = reason;
    }

    public static LexicalError unexpectedCharacter(char c, SourceSpan span) {
        return new LexicalError("Unexpected character '" + c + "'", span);
    }

    public static LexicalError unterminatedString(SourceSpan span) {
        return new LexicalError("Unterminated string literal", span);
    }

    public static LexicalError inputTooLarge(int maxInputSize, SourceSpan span) {
        return new LexicalError("Input exceeds maximum size of " + maxInputSize + " characters", span);
    }

    @Override
    public String reason() {
        return reason;
    }

    @Override
    public String code() {
        return "E0001";
    }
}
