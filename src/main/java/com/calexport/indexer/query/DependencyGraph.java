package com.calexport.indexer.query;

import java.util.List;

import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.reference.Reference;

import lombok.Builder;
import lombok.Value;

/**
 * Edges into and out of one object. The side not asked for is empty.
 */
@Value
@Builder
public class DependencyGraph {
    ObjectHeader object;
    Direction direction;
    List<Reference> incoming;
    List<Reference> outgoing;
}
