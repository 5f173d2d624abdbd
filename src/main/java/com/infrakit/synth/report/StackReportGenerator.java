package com.infrakit.synth.report;

import com.infrakit.synth.diff.IdPair;
import com.infrakit.synth.diff.StackDiff;
import com.infrakit.synth.model.Asset;
import com.infrakit.synth.model.Resource;
import com.infrakit.synth.stack.Template;
import com.infrakit.synth.util.FileWriteUtil;
import freemarker.template.Configuration;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a Markdown overview of a template: its resources, its assets, its tags and,
 * when one is given, the diff against the previously deployed template.
 */
public class StackReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(StackReportGenerator.class);

    static final String REPORT_TEMPLATE = "stack-report.ftl";

    private final Configuration freemarkerConfig;

    public StackReportGenerator() {
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

    /**
     * @param diff may be {@code null} when there is nothing to compare against
     */
    public String render(String title, Template template, StackDiff diff) throws IOException {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("title", title);
        model.put("resources", resourceRows(template));
        model.put("assets", template.getAssets().stream().map(Asset::toString).toList());
        model.put("tags", template.getTags());
        if (diff != null) {
            model.put("diff", diffModel(diff));
        }

        StringWriter out = new StringWriter();
        try {
            freemarkerConfig.getTemplate(REPORT_TEMPLATE).process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Unable to render stack report: " + e.getMessage(), e);
        }
        return out.toString();
    }

    public void write(String title, Template template, StackDiff diff, Path target) throws IOException {
        FileWriteUtil.safeWriteString(target, render(title, template, diff));
        log.info("Wrote stack report to {}", target);
    }

    private List<Map<String, String>> resourceRows(Template template) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (Resource resource : template.getResources()) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("resourceId", resource.getResourceId().getValue());
            row.put("wireId", template.wireIdOf(resource.getSynthesizedId()).getValue());
            row.put("type", resource.getType());
            rows.add(row);
        }
        return rows;
    }

    private Map<String, Object> diffModel(StackDiff diff) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("added", diff.getIntroduced().stream().map(IdPair::toString).toList());
        model.put("removed", diff.getRemoved().stream().map(IdPair::toString).toList());
        model.put("unchanged", diff.getUnchanged().stream().map(IdPair::toString).toList());
        model.put("hasChanges", diff.hasChanges());
        return model;
    }
}
