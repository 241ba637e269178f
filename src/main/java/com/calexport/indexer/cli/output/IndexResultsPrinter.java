package com.calexport.indexer.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.cli.model.IndexOptions;
import com.calexport.indexer.cli.model.ValidatedIndexOptions;
import com.calexport.indexer.index.ObjectSummary;
import com.calexport.indexer.loader.LoadFailure;
import com.calexport.indexer.loader.LoadResult;
import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.query.CategorizedSummary;
import com.calexport.indexer.query.CodeMatch;
import com.calexport.indexer.query.DependencyGraph;
import com.calexport.indexer.query.IndexStatistics;
import com.calexport.indexer.query.Member;
import com.calexport.indexer.query.PagedResult;
import com.calexport.indexer.query.QueryResult;
import com.calexport.indexer.reference.Reference;

/**
 * Responsible only for printing CLI output for the "cal-index" command.
 * No validation, no execution.
 */
public class IndexResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(IndexResultsPrinter.class);

    public void printBanner(IndexOptions o, ValidatedIndexOptions v) {
        log.info("=================================================");
        log.info("C/AL Symbol Indexer");
        log.info("=================================================");
        for (Path p : v.getPaths()) {
            log.info("Source: {}", p);
        }
        log.info("Charset: {}", v.getCharset());
        log.info("File Pattern: {}", o.getFilePattern());
        log.info("Recursive: {}", !o.isNoRecursive());
        log.info("Kind Filter: {}", v.getKind() != null ? v.getKind() : "None");
        log.info("Report: {}", v.getReportPath() != null ? v.getReportPath() : "None");
        log.info("=================================================");
    }

    public void printLoadResults(List<LoadResult> results) {
        for (LoadResult r : results) {
            log.info("{}: {} of {} object(s) loaded", r.getSource(), r.getObjectsLoaded(), r.getObjectsFound());
            for (LoadFailure f : r.getFailures()) {
                log.warn("  #{} {}: {}", f.getObjectIndex(), f.getHeaderLine(), f.getMessage());
            }
        }
    }

    public void printStatistics(IndexStatistics stats) {
        log.info("");
        log.info("=================================================");
        log.info("INDEX STATISTICS");
        log.info("=================================================");
        log.info("Objects: {}", stats.getTotalObjects());
        stats.getObjectsByKind().forEach((kind, count) -> log.info("  {}: {}", kind, count));
        log.info("Rejected Objects: {}", stats.getFailedObjects());
        log.info("Bytes Read: {}", stats.getTotalBytes());
        log.info("=================================================");
    }

    public void printSearch(String pattern, PagedResult<CalObject> page) {
        section("SEARCH '" + pattern + "' (" + page.getItems().size() + " of " + page.getTotal() + ")");
        for (CalObject o : page.getItems()) {
            log.info("{} {} {}", o.getKind(), o.getId(), o.getName());
        }
        if (page.hasMore()) {
            log.info("... more results after offset {}", page.getOffset() + page.getItems().size());
        }
    }

    public void printSummary(CategorizedSummary categorized) {
        ObjectSummary s = categorized.getSummary();
        section("SUMMARY " + s.getHeader().describe());
        categorized.getMemberCounts().forEach((category, count) -> log.info("{}: {}", category, count));
        if (s.getFieldCount() > 0) {
            log.info("Fields ({} of {}):", s.getFields().size(), s.getFieldCount());
            s.getFields().forEach(f -> log.info("  {} {} : {}", f.getId(), f.getName(), f.getDataType()));
        }
        if (s.getProcedureCount() > 0) {
            log.info("Procedures ({} of {}):", s.getProcedures().size(), s.getProcedureCount());
            s.getProcedures().forEach(p -> log.info("  {}", p.getSignature()));
        }
    }

    public void printMembers(String category, PagedResult<Member> page) {
        section("MEMBERS " + category + " (" + page.getItems().size() + " of " + page.getTotal() + ")");
        for (Member m : page.getItems()) {
            log.info("{}{}{}", "  ".repeat(Math.max(0, m.getLevel())),
                    m.getId() != null ? m.getId() + " " : "",
                    m.getName() + (m.getType() != null ? " : " + m.getType() : ""));
        }
    }

    public void printReferences(String target, PagedResult<Reference> page) {
        section("REFERENCES TO '" + target + "' (" + page.getItems().size() + " of " + page.getTotal() + ")");
        page.getItems().forEach(r -> log.info("{}", r.describe()));
    }

    public void printDependencies(DependencyGraph graph) {
        section("DEPENDENCIES OF " + graph.getObject().describe() + " (" + graph.getDirection() + ")");
        if (graph.getDirection().includesOutgoing()) {
            log.info("Outgoing ({}):", graph.getOutgoing().size());
            graph.getOutgoing().forEach(r -> log.info("  {}", r.describe()));
        }
        if (graph.getDirection().includesIncoming()) {
            log.info("Incoming ({}):", graph.getIncoming().size());
            graph.getIncoming().forEach(r -> log.info("  {}", r.describe()));
        }
    }

    public void printRelations(List<Reference> relations) {
        section("TABLE RELATIONS (" + relations.size() + ")");
        relations.forEach(r -> log.info("{}", r.describe()));
    }

    public void printCodeMatches(String regex, List<CodeMatch> matches) {
        section("CODE /" + regex + "/ (" + matches.size() + ")");
        for (CodeMatch m : matches) {
            log.info("{} {} {} / {}:{}  {}", m.getObjectKind(), m.getObjectId(), m.getObjectName(),
                    m.getProcedureName(), m.getLineNumber(), m.getLine());
        }
    }

    public void printProblem(QueryResult<?> result) {
        log.warn("{}: {}", result.getStatus(), result.getMessage());
    }

    public void printReportWritten(Path report) {
        log.info("Report written to {}", report);
    }

    private static void section(String title) {
        log.info("");
        log.info("-------------------------------------------------");
        log.info(title);
        log.info("-------------------------------------------------");
    }
}
