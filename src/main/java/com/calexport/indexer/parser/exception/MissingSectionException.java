package com.calexport.indexer.parser.exception;

public class MissingSectionException extends ObjectParseException {

    private static final long serialVersionUID = 1L;
    private final String section;

    public MissingSectionException(String section) {
        this(section, null);
    }

    public MissingSectionException(String section, String object) {
        super(object == null
                ? "Missing section " + section
                : "Missing section " + section + " in " + object);
        this.section = section;
    }

    public String getSection() {
        return section;
    }
}
