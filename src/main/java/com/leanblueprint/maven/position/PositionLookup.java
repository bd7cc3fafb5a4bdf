package com.leanblueprint.maven.position;

import java.io.IOException;
import java.util.List;

/**
 * Finds the Lean declarations of blueprint nodes.
 */
public interface PositionLookup {
    /**
     * @param nodesJson node list as produced by {@link NodeJson#write}
     * @param modules   Lean modules from which the declarations are reachable
     * @return the same list with {@code hasLean}, {@code location} and {@code file} added
     * @throws IOException if the lookup fails; the conversion cannot continue
     */
    String lookup(String nodesJson, List<String> modules) throws IOException;
}
