package com.leanblueprint.maven.template;

import java.io.IOException;
import java.util.Map;

/**
 * Renders named templates for generated Lean source.
 */
public interface TemplateEngine {
    /**
     * Renders a template with the given context.
     *
     * @param templateName file name of the template (e.g., "upstream.lean.mustache")
     * @param context values substituted into the template
     * @return the rendered text without its trailing line break
     * @throws IOException if the template cannot be loaded
     */
    String render(String templateName, Map<String, Object> context) throws IOException;
}
