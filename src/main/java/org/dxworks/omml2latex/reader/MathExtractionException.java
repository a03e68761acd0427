package org.dxworks.omml2latex.reader;

/**
 * Raised when a source file cannot be opened or its XML cannot be parsed.
 */
public class MathExtractionException extends RuntimeException {

    public MathExtractionException(String message) {
        super(message);
    }

    public MathExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
