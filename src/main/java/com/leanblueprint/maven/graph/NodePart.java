package com.leanblueprint.maven.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.leanblueprint.maven.lean.Docstrings;

/**
 * One half (statement or proof) of a blueprint node.
 * Mutated in place while labels are resolved and while prose is transcoded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodePart {

    private boolean leanOk;
    private String text = "";
    private Set<String> uses = new LinkedHashSet<>();
    private Set<String> usesRaw = new LinkedHashSet<>();
    private String latexEnv;

    public NodePart() {
    }

    public NodePart(boolean leanOk, String text, Collection<String> usesRaw, String latexEnv) {
        this.leanOk = leanOk;
        this.text = text == null ? "" : text;
        if (usesRaw != null) {
            this.usesRaw.addAll(usesRaw);
        }
        this.latexEnv = latexEnv;
    }

    public boolean isLeanOk() {
        return leanOk;
    }

    public void setLeanOk(boolean leanOk) {
        this.leanOk = leanOk;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    /** Resolved dependencies (node identifiers). */
    public Set<String> getUses() {
        return uses;
    }

    public void setUses(Collection<String> uses) {
        this.uses = uses == null ? new LinkedHashSet<>() : new LinkedHashSet<>(uses);
    }

    /** Unresolved dependencies (raw LaTeX labels). */
    public Set<String> getUsesRaw() {
        return usesRaw;
    }

    public void setUsesRaw(Collection<String> usesRaw) {
        this.usesRaw = usesRaw == null ? new LinkedHashSet<>() : new LinkedHashSet<>(usesRaw);
    }

    public String getLatexEnv() {
        return latexEnv;
    }

    public void setLatexEnv(String latexEnv) {
        this.latexEnv = latexEnv;
    }

    /**
     * Resolved uses as bare identifiers followed by raw uses as quoted string literals.
     */
    public List<String> allUses() {
        List<String> all = new ArrayList<>(uses);
        for (String raw : usesRaw) {
            all.add(Docstrings.quote(raw));
        }
        return all;
    }
}
