package com.calexport.indexer.query;

import lombok.Builder;
import lombok.Value;

/**
 * Flat view of one member of an object, as returned by member searches.
 */
@Value
@Builder
public class Member {
    MemberCategory category;
    String name;
    Integer id;
    /** Data type, control type, node type or signature, depending on the category. */
    String type;
    int level;
    String detail;
}
