package com.leanblueprint.maven.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;

/**
 * Loads stub templates with user override support.
 * Resolution order: user template directory -> plugin classpath
 */
public class TemplateLoader {
    static final String CLASSPATH_DIR = "/blueprint/templates/";

    private final Path userTemplateDir;
    private final Log log;

    public TemplateLoader(Path userTemplateDir, Log log) {
        this.userTemplateDir = userTemplateDir;
        this.log = log;
    }

    /**
     * Loads a template, trying the user directory first.
     *
     * @param templateName file name of the template (e.g., "informal-theorem.lean.mustache")
     * @return template content
     * @throws IOException if template cannot be found
     */
    public String loadTemplate(String templateName) throws IOException {
        if (userTemplateDir != null) {
            Path userTemplate = userTemplateDir.resolve(templateName);
            if (Files.isRegularFile(userTemplate)) {
                log.debug("Using user template: " + userTemplate);
                return Files.readString(userTemplate);
            }
        }

        String resourcePath = CLASSPATH_DIR + templateName;
        try (InputStream inputStream = TemplateLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream != null) {
                log.debug("Using classpath template: " + resourcePath);
                return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        throw new IOException("Template not found: " + templateName
                + " (checked user: " + userTemplateDir + ", classpath: " + resourcePath + ")");
    }
}
