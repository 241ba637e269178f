package com.calexport.indexer.parser.exception;

/**
 * A tree item whose level has no possible parent (nonzero level with nothing open above it).
 */
public class MalformedHierarchyException extends ObjectParseException {

    private static final long serialVersionUID = 1L;
    private final int level;

    public MalformedHierarchyException(int level, String item) {
        super("Item '" + item + "' at level " + level + " has no enclosing item");
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
