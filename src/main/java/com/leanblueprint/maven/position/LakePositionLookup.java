package com.leanblueprint.maven.position;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.leanblueprint.maven.ExternalCommand;

/**
 * Position lookup backed by a Lean executable, by default
 * {@code lake exe add_position_info --imports <modules>} run in the Lean project.
 */
public class LakePositionLookup implements PositionLookup {

    private final List<String> command;
    private final Path projectDir;

    public LakePositionLookup(List<String> command, Path projectDir) {
        this.command = List.copyOf(command);
        this.projectDir = projectDir;
    }

    @Override
    public String lookup(String nodesJson, List<String> modules) throws IOException {
        List<String> fullCommand = new ArrayList<>(command);
        fullCommand.add("--imports");
        fullCommand.add(String.join(",", modules));
        return ExternalCommand.run(fullCommand, projectDir, nodesJson);
    }
}
