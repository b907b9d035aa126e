package com.processdoc.analyzer.render;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Base for renderers backed by a FreeMarker template under {@code /templates}.
 */
public abstract class TemplateRenderer {

    private final Configuration freemarkerConfig;

    protected TemplateRenderer() {
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

    protected void process(String templateName, Map<String, Object> dataModel, Writer writer) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        try {
            template.process(dataModel, writer);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + templateName + ": " + e.getMessage(), e);
        }
        writer.flush();
    }
}
