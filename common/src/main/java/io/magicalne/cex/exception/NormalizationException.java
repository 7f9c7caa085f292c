package io.magicalne.cex.exception;

/**
 * Base of the recoverable failures raised while converting exchange data into canonical values.
 */
public class NormalizationException extends Exception {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
