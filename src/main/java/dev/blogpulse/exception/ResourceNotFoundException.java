package dev.blogpulse.exception;

/**
 * A requested session or post does not exist. The message is a message-bundle key
 * or a plain message.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
