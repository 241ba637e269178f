package com.calexport.indexer.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.index.ObjectSummary;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.query.CategorizedSummary;
import com.calexport.indexer.query.IndexStatistics;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Markdown views of an object summary and of the index statistics, rendered from the
 * FreeMarker templates under {@code /templates}.
 */
public class SymbolReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(SymbolReportRenderer.class);

    static final String SUMMARY_TEMPLATE = "object-summary.md.ftl";
    static final String STATISTICS_TEMPLATE = "index-statistics.md.ftl";

    private final Configuration freemarkerConfig;

    public SymbolReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String renderSummary(CategorizedSummary categorized) {
        ObjectSummary summary = categorized.getSummary();
        ObjectHeader header = summary.getHeader();

        Map<String, Object> model = new HashMap<>();
        model.put("kind", header.getKind().getToken());
        model.put("id", header.getId());
        model.put("name", header.getName());
        model.put("date", header.getMetadata().date().orElse(""));
        model.put("time", header.getMetadata().time().orElse(""));
        model.put("versionList", header.getMetadata().versionList().orElse(""));
        model.put("propertyCount", summary.getPropertyCount());
        model.put("fields", summary.getFields());
        model.put("fieldCount", summary.getFieldCount());
        model.put("procedures", summary.getProcedures());
        model.put("procedureCount", summary.getProcedureCount());

        List<Map<String, Object>> counts = new ArrayList<>();
        categorized.getMemberCounts().forEach((category, count) ->
                counts.add(Map.of("category", category.getLabel(), "count", count)));
        model.put("memberCounts", counts);

        List<Map<String, Object>> groups = new ArrayList<>();
        categorized.getProcedureGroups().forEach((group, names) ->
                groups.add(Map.of("name", group, "procedures", names)));
        model.put("procedureGroups", groups);

        return render(SUMMARY_TEMPLATE, model);
    }

    public String renderStatistics(IndexStatistics statistics) {
        Map<String, Object> model = new HashMap<>();
        model.put("totalObjects", statistics.getTotalObjects());
        model.put("failedObjects", statistics.getFailedObjects());
        model.put("totalBytes", statistics.getTotalBytes());
        model.put("sources", statistics.getSources());

        List<Map<String, Object>> kinds = new ArrayList<>();
        statistics.getObjectsByKind().forEach((kind, count) ->
                kinds.add(Map.of("kind", kind.getToken(), "count", count)));
        model.put("kinds", kinds);

        return render(STATISTICS_TEMPLATE, model);
    }

    public void write(Path target, String markdown) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, markdown, StandardCharsets.UTF_8);
        log.info("Wrote report {}", target);
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render " + templateName, e);
        }
    }
}
