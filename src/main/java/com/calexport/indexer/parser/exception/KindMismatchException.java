package com.calexport.indexer.parser.exception;

import java.util.Set;

import com.calexport.indexer.model.ObjectKind;

public class KindMismatchException extends ObjectParseException {

    private static final long serialVersionUID = 1L;

    public KindMismatchException(ObjectKind actual, Set<ObjectKind> expected) {
        super("Expected object of kind " + expected + " but got " + actual);
    }
}
