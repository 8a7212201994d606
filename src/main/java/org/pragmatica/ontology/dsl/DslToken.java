package org.pragmatica.ontology.dsl;

import org.pragmatica.ontology.tree.SourceLocation;
import org.pragmatica.ontology.tree.SourceSpan;

import java.util.Objects;

/**
 * A single DSL token.
 *
 * @param kind  token kind
 * @param text  literal value: identifier or keyword text, string contents with escapes
 *              resolved, number text as written, or the punctuation itself
 * @param span  source range covered by the token
 */
public record DslToken(TokenKind kind, String text, SourceSpan span) {

    public DslToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(span, "span");
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

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + span.start();
    }
}
