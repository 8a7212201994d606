package org.pragmatica.ontology.error;

import org.pragmatica.ontology.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler diagnostic rendered against the DSL source.
 *
 * <p>Example output:
 * <pre>
 * error[E0002]: Expected identifier but found number
 *   --> pipeline.dsl:3:22
 *    |
 *  3 | LOAD_CSV "level1.csv" AS 42
 *    |                          ^^ unexpected number
 *    |
 * </pre>
 *
 * @param severity Error severity level
 * @param code     Optional error code (e.g., "E0001"), may be {@code null}
 * @param message  Primary error message
 * @param span     Source span where the problem was found
 * @param label    Text shown next to the underline, empty for none
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    String label,
    List<String> notes
) {
    public enum Severity {
        ERROR("error");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, null, message, span, "", List.of());
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, "", List.of());
    }

    public Diagnostic withLabel(String text) {
        return new Diagnostic(severity, code, message, span, text, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending source line and an underline.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be {@code null}
     * @return Formatted diagnostic text, newline-terminated
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int gutterWidth = String.valueOf(loc.line()).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = stripCarriageReturn(lines[loc.line() - 1]);
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underline(lineContent))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:column: severity: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s",
                             filename == null ? "input" : filename,
                             loc.line(),
                             loc.column(),
                             severity.display(),
                             message);
    }

    private String underline(String lineContent) {
        int startCol = span.start().column();
        int endCol = span.isSingleLine()
                     ? span.end().column()
                     : lineContent.length() + 1;
        int width = Math.max(1, endCol - startCol);

        var sb = new StringBuilder();
        sb.append(" ".repeat(Math.max(0, startCol - 1)));
        sb.append("^".repeat(width));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        return sb.toString();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r")
               ? line.substring(0, line.length() - 1)
               : line;
    }
}
