package com.calexport.indexer.parser.grammar;

import java.util.Map;

import lombok.Value;

/**
 * Language-tag to text pairs, e.g. {@code ENU=Code;DEU=Code}. The {@code @@@} pseudo tag is
 * not a language; it holds a comment for translators.
 */
@Value
public class LocalizedText {
    public static final String COMMENT_TAG = "@@@";

    Map<String, String> texts;
    String translatorComment;
}
