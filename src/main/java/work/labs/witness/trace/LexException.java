package work.labs.witness.trace;

/**
 * Fatal structural error in a raw trace. Parsing stops at the first one; no event is guessed.
 */
public class LexException extends RuntimeException {
    private final String code;
    private final int line;

    public LexException(int line, String message) {
        this("lex_error", line, message, null);
    }

    public LexException(int line, String message, Throwable cause) {
        this("lex_error", line, message, cause);
    }

    protected LexException(String code, int line, String message, Throwable cause) {
        super("line " + line + ": " + message, cause);
        this.code = code;
        this.line = line;
    }

    public String code() {
        return code;
    }

    public int line() {
        return line;
    }
}
