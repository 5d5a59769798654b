package com.yongkangl.labeling.io;

/**
 * Thrown when the labeling alphabet size is not a positive integer.
 */
public class InvalidAlphabetSizeException extends IllegalArgumentException {
    public InvalidAlphabetSizeException(String message) {
        super(message);
    }

    public InvalidAlphabetSizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
