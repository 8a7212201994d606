package org.pragmatica.ontology.error;

import org.pragmatica.ontology.dsl.TokenKind;
import org.pragmatica.ontology.tree.SourceSpan;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The parser found a token of a kind it cannot accept at this point.
 */
public final class SyntaxError extends CompileError {
    private final Set<TokenKind> expected;
    private final TokenKind actual;

    public SyntaxError(Set<TokenKind> expected, TokenKind actual, SourceSpan span) {
        super(describe(expected, actual), span);
        this.expected = expected.isEmpty()
                        ? EnumSet.noneOf(TokenKind.class)
                        : EnumSet.copyOf(expected);
        this.actual = actual;
    }

    public SyntaxError(TokenKind expected, TokenKind actual, SourceSpan span) {
        this(EnumSet.of(expected), actual, span);
    }

    /**
     * Token kinds that would have been accepted.
     */
    public Set<TokenKind> expected() {
        return Set.copyOf(expected);
    }

    public TokenKind actual() {
        return actual;
    }

    @Override
    public String reason() {
        return describe(expected, actual);
    }

    @Override
    public String code() {
        return "E0002";
    }

    @Override
    public Diagnostic toDiagnostic() {
        var diagnostic = super.toDiagnostic()
                              .withLabel("unexpected " + actual.display());
        if (expected.size() > 1) {
            diagnostic = diagnostic.withHelp("expected one of " + joinKinds(expected));
        }
        return diagnostic;
    }

    private static String describe(Set<TokenKind> expected, TokenKind actual) {
        if (expected.size() == 1) {
            return "Expected " + expected.iterator().next().display() + " but found " + actual.display();
        }
        return "Expected one of " + joinKinds(expected) + " but found " + actual.display();
    }

    private static String joinKinds(Set<TokenKind> kinds) {
        return kinds.stream()
                    .sorted()
                    .map(TokenKind::display)
                    .collect(Collectors.joining(", "));
    }
}
