package com.calexport.indexer.parser.exception;

/**
 * Base of the parse failures. Each one is fatal for the object (or section) being parsed,
 * never for a whole batch.
 */
public class ObjectParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ObjectParseException(String message) {
        super(message);
    }

    public ObjectParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
