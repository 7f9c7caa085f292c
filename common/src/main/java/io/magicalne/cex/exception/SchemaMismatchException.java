package io.magicalne.cex.exception;

public class SchemaMismatchException extends NormalizationException {
    private static final String ERR_MSG = "Expected %s at '%s' but found %s";

    private final String path;

    public SchemaMismatchException(String path, String expected, String actual) {
        super(String.format(ERR_MSG, expected, path, actual));
        this.path = path;
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
        this.path = "";
    }

    public String getPath() {
        return path;
    }
}
