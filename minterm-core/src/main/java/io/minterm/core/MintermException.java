package io.minterm.core;

/**
 * Raised when a collaborator of the classifier fails while a minterm table is
 * being built, for example a range converter that throws.
 */
public class MintermException extends RuntimeException {

    public MintermException(String message, Throwable cause) {
        super(message, cause);
    }
}
