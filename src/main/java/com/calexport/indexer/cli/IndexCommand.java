package com.calexport.indexer.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.cli.exception.OptionsValidationException;
import com.calexport.indexer.cli.model.IndexOptions;
import com.calexport.indexer.cli.model.ValidatedIndexOptions;
import com.calexport.indexer.cli.output.IndexResultsPrinter;
import com.calexport.indexer.cli.validation.IndexOptionsValidator;
import com.calexport.indexer.config.IndexerConfig;
import com.calexport.indexer.loader.LoadResult;
import com.calexport.indexer.loader.ObjectFileLoader;
import com.calexport.indexer.query.CategorizedSummary;
import com.calexport.indexer.query.IndexContext;
import com.calexport.indexer.query.IndexQueryService;
import com.calexport.indexer.query.IndexStatistics;
import com.calexport.indexer.query.QueryResult;
import com.calexport.indexer.report.SymbolReportRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that loads C/AL export files into a symbol index and runs queries against it.
 */
@Command(
        name = "cal-index",
        mixinStandardHelpOptions = true,
        version = "cal-symbol-indexer 1.0.0",
        description = "Indexes C/AL object text exports and searches the resulting symbols and references."
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Mixin
    private IndexOptions options = new IndexOptions();

    private final IndexOptionsValidator validator = new IndexOptionsValidator();
    private final IndexResultsPrinter printer = new IndexResultsPrinter();
    private final SymbolReportRenderer renderer = new SymbolReportRenderer();

    @Override
    public Integer call() {
        ValidatedIndexOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return EXIT_USAGE;
        }
        printer.printBanner(options, validated);

        IndexerConfig config = IndexerConfig.builder()
                .charset(validated.getCharset())
                .filePattern(options.getFilePattern())
                .recursive(!options.isNoRecursive())
                .defaultLimit(options.getLimit())
                .build();
        IndexContext context = new IndexContext(config);
        ObjectFileLoader loader = new ObjectFileLoader(context);

        List<LoadResult> results = new ArrayList<>();
        try {
            for (Path path : validated.getPaths()) {
                results.addAll(loader.load(path));
            }
        } catch (IOException e) {
            log.error("Loading failed", e);
            return EXIT_FAILED;
        }
        printer.printLoadResults(results);

        IndexQueryService queries = new IndexQueryService(context);
        IndexStatistics statistics = queries.getStatistics();
        printer.printStatistics(statistics);

        String kind = options.getKind();
        boolean ok = true;

        if (options.getSearch() != null) {
            var found = queries.searchObjects(options.getSearch(), kind, options.getLimit(), options.getOffset());
            ok &= report(found, () -> printer.printSearch(options.getSearch(), found.getValue()));
        }

        CategorizedSummary summary = null;
        if (options.getSummary() != null) {
            QueryResult<CategorizedSummary> r = queries.getSummary(options.getSummary(), kind);
            if (r.isOk()) {
                summary = r.getValue();
                printer.printSummary(summary);
            } else {
                printer.printProblem(r);
                ok = false;
            }
            if (options.getMembers() != null) {
                var members = queries.getMembers(options.getSummary(), kind, options.getMembers(), null,
                        options.getLimit(), options.getOffset());
                ok &= report(members, () -> printer.printMembers(options.getMembers(), members.getValue()));
            }
        }

        if (options.getReferences() != null) {
            var refs = queries.findReferences(options.getReferences(), options.getField(), options.getReferenceType(),
                    options.getLimit(), options.getOffset());
            ok &= report(refs, () -> printer.printReferences(options.getReferences(), refs.getValue()));
        }

        if (options.getDependencies() != null) {
            var graph = queries.getDependencies(kind, options.getDependencies(), options.getDirection());
            ok &= report(graph, () -> printer.printDependencies(graph.getValue()));
        }

        if (options.isRelations()) {
            var relations = queries.getTableRelations(null, options.getTableId(), options.isIncludeCalcFormula());
            ok &= report(relations, () -> printer.printRelations(relations.getValue()));
        }

        if (options.getCode() != null) {
            var matches = queries.searchCode(options.getCode(), kind, options.getLimit());
            ok &= report(matches, () -> printer.printCodeMatches(options.getCode(), matches.getValue()));
        }

        if (validated.getReportPath() != null) {
            String markdown = summary != null
                    ? renderer.renderSummary(summary)
                    : renderer.renderStatistics(statistics);
            try {
                renderer.write(validated.getReportPath(), markdown);
            } catch (IOException e) {
                log.error("Could not write report {}", validated.getReportPath(), e);
                return EXIT_FAILED;
            }
            printer.printReportWritten(validated.getReportPath());
        }

        return ok ? EXIT_OK : EXIT_FAILED;
    }

    private boolean report(QueryResult<?> result, Runnable print) {
        if (result.isOk()) {
            print.run();
            return true;
        }
        printer.printProblem(result);
        return false;
    }
}
