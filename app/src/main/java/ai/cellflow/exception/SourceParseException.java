package ai.cellflow.exception;

/** The Python parser rejected a fragment's source text. No fragment is created. */
public class SourceParseException extends RuntimeException {
    private final int line;
    private final int column;

    public SourceParseException(String reason, int line, int column) {
        super("Cannot parse fragment at line " + line + ", column " + column + ": " + reason);
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the first syntax error. */
    public int line() {
        return line;
    }

    /** 1-based column of the first syntax error. */
    public int column() {
        return column;
    }
}
