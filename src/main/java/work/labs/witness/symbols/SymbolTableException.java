package work.labs.witness.symbols;

/**
 * Raised when a symbol table (or one of its type descriptors) cannot be read.
 */
public final class SymbolTableException extends RuntimeException {
    public SymbolTableException(String message) {
        super(message);
    }

    public SymbolTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
