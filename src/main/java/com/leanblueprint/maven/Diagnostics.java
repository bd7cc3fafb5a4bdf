package com.leanblueprint.maven;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.maven.plugin.logging.Log;

/**
 * Structural warnings collected during one conversion run.
 * <p>
 * Every warning is forwarded to the Maven log as it is reported. Warnings
 * registered with {@link #warnOnce(String, String)} are reported at most once
 * per run.
 */
public class Diagnostics {

    private final Log log;
    private final List<String> warnings = new ArrayList<>();
    private final Set<String> latched = new HashSet<>();

    public Diagnostics(Log log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public void warn(String message) {
        warnings.add(message);
        log.warn(message);
    }

    /**
     * Reports the warning unless a warning with the same key was already reported.
     *
     * @return true if the warning was reported by this call
     */
    public boolean warnOnce(String key, String message) {
        if (!latched.add(key)) {
            return false;
        }
        warn(message);
        return true;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public Log getLog() {
        return log;
    }
}
