package com.calexport.indexer.parser.exception;

/**
 * The {@code OBJECT <kind> <id> <name>} line could not be read.
 */
public class InvalidDeclarationException extends ObjectParseException {

    private static final long serialVersionUID = 1L;
    private final String line;

    public InvalidDeclarationException(String line, String reason) {
        super("Invalid object declaration '" + line + "': " + reason);
        this.line = line;
    }

    public InvalidDeclarationException(String line, String reason, Throwable cause) {
        super("Invalid object declaration '" + line + "': " + reason, cause);
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
