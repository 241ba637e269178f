package com.calexport.indexer.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.calexport.indexer.config.IndexerConfig;
import com.calexport.indexer.index.SymbolDatabase;
import com.calexport.indexer.loader.LoadResult;

import lombok.Getter;

/**
 * Everything a query runs against: the database, the sources loaded into it and the config.
 * Created by the caller and passed to the loader and the query service.
 *
 * Same threading contract as {@link SymbolDatabase}.
 */
@Getter
public class IndexContext {
    private final IndexerConfig config;
    private final SymbolDatabase database;
    private final List<LoadResult> loadResults = new ArrayList<>();

    public IndexContext() {
        this(IndexerConfig.defaults());
    }

    public IndexContext(IndexerConfig config) {
        this(config, new SymbolDatabase());
    }

    public IndexContext(IndexerConfig config, SymbolDatabase database) {
        this.config = config;
        this.database = database;
    }

    public void record(LoadResult result) {
        loadResults.add(result);
    }

    public List<LoadResult> getLoadResults() {
        return Collections.unmodifiableList(loadResults);
    }

    public List<String> getLoadedSources() {
        return loadResults.stream().map(LoadResult::getSource).toList();
    }

    public void clear() {
        database.clear();
        loadResults.clear();
    }
}
