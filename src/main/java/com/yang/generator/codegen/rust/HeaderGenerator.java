package com.yang.generator.codegen.rust;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.yang.generator.codegen.exception.GenerationException;
import com.yang.generator.codegen.model.core.context.GeneratorConfig;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * License notice and {@code use} declarations at the top of the generated file.
 */
public class HeaderGenerator {

    static final String TEMPLATE_NAME = "rust-header.ftl";

    private final Configuration freemarkerConfig;

    public HeaderGenerator() {
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

    public String render(GeneratorConfig config) {
        Map<String, Object> model = new HashMap<>();
        model.put("year", config.getCopyrightYear());
        model.put("holder", config.getCopyrightHolder());
        model.put("generator", GeneratorConfig.GENERATOR_NAME);

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new GenerationException("Failed to render " + TEMPLATE_NAME, e);
        }
    }
}
