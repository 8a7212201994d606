package org.pragmatica.ontology.tree;

/**
 * A range of source text from start (inclusive) to end (exclusive), as covered by one token.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public boolean isSingleLine() {
        return start.line() == end.line();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
