package com.leanblueprint.maven.graph;

import java.util.LinkedHashSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A vertex of the blueprint dependency graph: one formal statement, optionally
 * paired with its proof. Nodes without a proof are definition-like, nodes with
 * a proof are theorem-like.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Node {

    private String name;
    private NodePart statement;
    private NodePart proof;
    private boolean notReady;
    private Integer discussion;
    private String title;

    public Node() {
    }

    public Node(String name, NodePart statement, boolean notReady, Integer discussion, String title) {
        this.name = name;
        this.statement = statement;
        this.notReady = notReady;
        this.discussion = discussion;
        this.title = title;
    }

    /** Lean identifier, unique across the graph. */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public NodePart getStatement() {
        return statement;
    }

    public void setStatement(NodePart statement) {
        this.statement = statement;
    }

    public NodePart getProof() {
        return proof;
    }

    public void setProof(NodePart proof) {
        this.proof = proof;
    }

    public boolean isNotReady() {
        return notReady;
    }

    public void setNotReady(boolean notReady) {
        this.notReady = notReady;
    }

    public Integer getDiscussion() {
        return discussion;
    }

    public void setDiscussion(Integer discussion) {
        this.discussion = discussion;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public boolean hasProof() {
        return proof != null;
    }

    /**
     * Union of the resolved dependencies of the statement and the proof.
     */
    @JsonIgnore
    public Set<String> getUses() {
        Set<String> all = new LinkedHashSet<>(statement.getUses());
        if (proof != null) {
            all.addAll(proof.getUses());
        }
        return all;
    }
}
