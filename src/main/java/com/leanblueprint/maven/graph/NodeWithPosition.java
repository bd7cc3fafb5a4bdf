package com.leanblueprint.maven.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A node enriched by the position lookup with the location of its Lean declaration, if any.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeWithPosition extends Node {

    @JsonProperty("hasLean")
    private boolean hasLean;
    private DeclarationLocation location;
    private String file;

    public NodeWithPosition() {
    }

    @JsonProperty("hasLean")
    public boolean hasLean() {
        return hasLean;
    }

    @JsonProperty("hasLean")
    public void setHasLean(boolean hasLean) {
        this.hasLean = hasLean;
    }

    public DeclarationLocation getLocation() {
        return location;
    }

    public void setLocation(DeclarationLocation location) {
        this.location = location;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }
}
