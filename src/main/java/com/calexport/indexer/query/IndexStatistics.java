package com.calexport.indexer.query;

import java.util.List;
import java.util.Map;

import com.calexport.indexer.model.ObjectKind;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class IndexStatistics {
    int totalObjects;
    @Singular("kindCount")
    Map<ObjectKind, Integer> objectsByKind;
    @Singular
    List<String> sources;
    int failedObjects;
    long totalBytes;
}
