package com.calexport.indexer.parser;

import lombok.Value;

/**
 * One named top-level block. {@code text} runs from the keyword to the closing brace,
 * {@code body} is what lies between the braces.
 */
@Value
public class Section {
    String name;
    String text;
    String body;
    int start;
    int end;
}
