package com.calexport.indexer.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.Data;

/**
 * Settings shared by the loader and the query service.
 */
@Data
@Builder
public class IndexerConfig {

    /**
     * Encoding of export files. Exports saved from the development environment are usually
     * UTF-8 with a BOM or the Windows ANSI code page.
     */
    @Builder.Default
    private Charset charset = StandardCharsets.UTF_8;

    /**
     * Glob matched against file names when loading a directory.
     */
    @Builder.Default
    private String filePattern = "*.txt";

    /**
     * Whether directory loads descend into subdirectories.
     */
    @Builder.Default
    private boolean recursive = true;

    /**
     * Page size used by queries that are not given a limit.
     */
    @Builder.Default
    private int defaultLimit = 20;

    /**
     * Number of fields and procedures listed in an object summary.
     */
    @Builder.Default
    private int summaryPrefixSize = 10;

    public static IndexerConfig defaults() {
        return IndexerConfig.builder().build();
    }
}
