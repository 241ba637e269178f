package com.calexport.indexer;

import com.calexport.indexer.cli.IndexCommand;

import picocli.CommandLine;

/**
 * Main entry point for the C/AL symbol indexer.
 * Loads object text exports and answers search, summary and reference queries from the command line.
 */
public class IndexerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new IndexCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
