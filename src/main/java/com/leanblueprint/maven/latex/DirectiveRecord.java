package com.leanblueprint.maven.latex;

import java.util.List;

/**
 * Directives found in one environment: the label, plastexdepgraph commands
 * (<code>&#92;uses</code>, {@code \alsoIn}, {@code \proves}) and leanblueprint commands
 * ({@code \leanok}, {@code \notready}, {@code \mathlibok}, {@code \lean},
 * {@code \discussion}).
 */
public class DirectiveRecord {

    private final String label;
    private final List<String> uses;
    private final List<String> alsoIn;
    private final String proves;
    private final boolean leanOk;
    private final boolean notReady;
    private final boolean mathlibOk;
    private final String lean;
    private final Integer discussion;

    public DirectiveRecord(String label, List<String> uses, List<String> alsoIn, String proves,
            boolean leanOk, boolean notReady, boolean mathlibOk, String lean, Integer discussion) {
        this.label = label;
        this.uses = uses == null ? List.of() : List.copyOf(uses);
        this.alsoIn = alsoIn == null ? List.of() : List.copyOf(alsoIn);
        this.proves = proves;
        this.leanOk = leanOk;
        this.notReady = notReady;
        this.mathlibOk = mathlibOk;
        this.lean = lean;
        this.discussion = discussion;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getUses() {
        return uses;
    }

    public List<String> getAlsoIn() {
        return alsoIn;
    }

    public String getProves() {
        return proves;
    }

    public boolean isLeanOk() {
        return leanOk;
    }

    public boolean isNotReady() {
        return notReady;
    }

    public boolean isMathlibOk() {
        return mathlibOk;
    }

    /** Explicit Lean identifier from {@code \lean{...}}, or null. */
    public String getLean() {
        return lean;
    }

    public Integer getDiscussion() {
        return discussion;
    }
}
