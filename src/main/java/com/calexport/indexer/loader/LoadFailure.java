package com.calexport.indexer.loader;

import lombok.Value;

/**
 * One object that could not be parsed. {@code objectIndex} counts from 0 in source order; it is -1
 * when the whole source could not be read.
 */
@Value
public class LoadFailure {
    String source;
    int objectIndex;
    String headerLine;
    String message;

    public String describe() {
        return source + " #" + objectIndex + " (" + headerLine + "): " + message;
    }
}
