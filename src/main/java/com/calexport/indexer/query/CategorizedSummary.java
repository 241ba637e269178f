package com.calexport.indexer.query;

import java.util.List;
import java.util.Map;

import com.calexport.indexer.index.ObjectSummary;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Object summary plus member counts per category and procedure names grouped by role.
 */
@Value
@Builder
public class CategorizedSummary {
    ObjectSummary summary;
    @Singular
    Map<MemberCategory, Integer> memberCounts;
    /** "Event subscribers", "External", "Global" and "Local" procedure names; empty groups are left out. */
    @Singular
    Map<String, List<String>> procedureGroups;
}
