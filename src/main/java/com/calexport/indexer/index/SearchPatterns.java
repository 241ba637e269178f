package com.calexport.indexer.index;

import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Wildcard name patterns: {@code *} matches any run of characters, everything else is literal.
 * Matching is case-insensitive and covers the whole name.
 */
@UtilityClass
public class SearchPatterns {

    public static final String MATCH_ALL = "*";

    public static Pattern compile(String pattern) {
        String source = pattern == null || pattern.isBlank() ? MATCH_ALL : pattern.trim();
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = source.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(source.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < source.length()) {
            regex.append(Pattern.quote(source.substring(start)));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    public static boolean matches(Pattern compiled, String name) {
        return name != null && compiled.matcher(name).matches();
    }
}
