package io.magicalne.cex.exception;

public class MissingEnvelopeFieldException extends NormalizationException {
    private static final String ERR_MSG = "Could not find '%s' field at '%s'";

    private final String field;
    private final String path;

    public MissingEnvelopeFieldException(String field, String path) {
        super(String.format(ERR_MSG, field, path));
        this.field = field;
        this.path = path;
    }

    public String getField() {
        return field;
    }

    /**
     * Dotted path up to and including the missing segment, e.g. {@code data.body.data}.
     */
    public String getPath() {
        return path;
    }
}
