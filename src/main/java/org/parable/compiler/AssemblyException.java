package org.parable.compiler;

/**
 * Thrown when a message cannot be assembled or placed into an image.
 */
public class AssemblyException extends RuntimeException {

    public AssemblyException(String message) {
        super(message);
    }
}
