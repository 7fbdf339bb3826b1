package net.pagewise.core.error;

public class SchemaMismatchException extends Exception {
    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
