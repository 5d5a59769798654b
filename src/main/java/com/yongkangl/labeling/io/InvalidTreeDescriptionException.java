package com.yongkangl.labeling.io;

/**
 * Thrown when a depth sequence is not a nonempty pre-order traversal of a free tree.
 */
public class InvalidTreeDescriptionException extends IllegalArgumentException {
    public InvalidTreeDescriptionException(String message) {
        super(message);
    }

    public InvalidTreeDescriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
