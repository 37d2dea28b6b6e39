package org.contextql.dsl;

/**
 * Exception thrown when a context document cannot be parsed.
 *
 * Carries the source location when one is known (1-based line and column)
 * and, for structured documents, the path of the offending field such as
 * {@code datasets[1].dataset_id}. Parse errors are never retryable: the
 * document has to be edited.
 */
public class ContextParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final String path;
    private final String reason;

    public ContextParseException(String reason, int line, int column) {
        super("line " + line + ":" + column + " " + reason);
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.path = null;
    }

    public ContextParseException(String reason, String path) {
        super(path + ": " + reason);
        this.reason = reason;
        this.line = -1;
        this.column = -1;
        this.path = path;
    }

    public ContextParseException(String reason, int line, int column, Throwable cause) {
        super("line " + line + ":" + column + " " + reason, cause);
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.path = null;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getPath() {
        return path;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
