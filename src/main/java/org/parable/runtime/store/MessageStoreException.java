package org.parable.runtime.store;

/**
 * Thrown when the backing source of a {@link PagedMessageStore} cannot be read.
 */
public class MessageStoreException extends RuntimeException {

    public MessageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
