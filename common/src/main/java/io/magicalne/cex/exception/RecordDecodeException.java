package io.magicalne.cex.exception;

public class RecordDecodeException extends NormalizationException {
    private static final String ERR_MSG = "Cannot decode record #%d as %s: %s";

    private final int index;

    public RecordDecodeException(int index, Class<?> type, String reason) {
        super(String.format(ERR_MSG, index, type.getSimpleName(), reason));
        this.index = index;
    }

    public RecordDecodeException(int index, Class<?> type, Throwable cause) {
        super(String.format(ERR_MSG, index, type.getSimpleName(), cause.getMessage()), cause);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
