package io.magicalne.cex.exception;

/**
 * Thrown when a platform names a chain that is not known. Fails the normalization of the record.
 */
public class UnrecognizedBlockchainException extends RuntimeException {

    private final String name;

    public UnrecognizedBlockchainException(String name) {
        super("Unrecognized blockchain: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
