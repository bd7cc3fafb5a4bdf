package com.leanblueprint.maven.template;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;

/**
 * Mustache-based template engine. Templates are compiled once per run.
 * <p>
 * Lean source must not be HTML-escaped, so templates use triple mustaches.
 */
public class MustacheTemplateEngine implements TemplateEngine {
    private final TemplateLoader templateLoader;
    private final MustacheFactory mustacheFactory;
    private final Map<String, Mustache> compiled = new HashMap<>();

    public MustacheTemplateEngine(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
        this.mustacheFactory = new DefaultMustacheFactory();
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws IOException {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            String templateContent = templateLoader.loadTemplate(templateName);
            mustache = mustacheFactory.compile(new StringReader(templateContent), templateName);
            compiled.put(templateName, mustache);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, context).flush();
        String rendered = writer.toString();
        return rendered.endsWith("\n") ? rendered.substring(0, rendered.length() - 1) : rendered;
    }
}
