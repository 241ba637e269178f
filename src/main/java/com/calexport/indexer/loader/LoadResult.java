package com.calexport.indexer.loader;

import java.util.List;

import com.calexport.indexer.model.ObjectKey;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of loading one source (a file or an in-memory text).
 */
@Value
@Builder
public class LoadResult {
    String source;
    int objectsFound;
    @Singular("loaded")
    List<ObjectKey> loadedKeys;
    @Singular
    List<LoadFailure> failures;
    long bytes;

    public int getObjectsLoaded() {
        return loadedKeys.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
