package com.leanblueprint.maven.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings for one conversion: external tool commands and the text inserted into
 * Lean and LaTeX sources.
 */
public class ConversionConfig {
    public static final String DEFAULT_IMPORT_LINE = "import Architect";
    public static final String DEFAULT_NODE_INPUT_COMMAND = "inputleannode";
    public static final List<String> DEFAULT_POSITION_LOOKUP_COMMAND = List.of("lake", "exe", "add_position_info");
    public static final List<String> DEFAULT_TRANSCODER_COMMAND = List.of("pandoc");
    public static final int DEFAULT_TRANSCODER_COLUMNS = 100;

    private String importLine = DEFAULT_IMPORT_LINE;
    private String nodeInputCommand = DEFAULT_NODE_INPUT_COMMAND;
    private List<String> positionLookupCommand = new ArrayList<>(DEFAULT_POSITION_LOOKUP_COMMAND);
    private List<String> transcoderCommand = new ArrayList<>(DEFAULT_TRANSCODER_COMMAND);
    private int transcoderColumns = DEFAULT_TRANSCODER_COLUMNS;

    public String getImportLine() {
        return importLine;
    }

    public void setImportLine(String importLine) {
        this.importLine = importLine;
    }

    public String getNodeInputCommand() {
        return nodeInputCommand;
    }

    public void setNodeInputCommand(String nodeInputCommand) {
        this.nodeInputCommand = nodeInputCommand;
    }

    public List<String> getPositionLookupCommand() {
        return positionLookupCommand;
    }

    public void setPositionLookupCommand(List<String> positionLookupCommand) {
        this.positionLookupCommand = positionLookupCommand;
    }

    public List<String> getTranscoderCommand() {
        return transcoderCommand;
    }

    public void setTranscoderCommand(List<String> transcoderCommand) {
        this.transcoderCommand = transcoderCommand;
    }

    public int getTranscoderColumns() {
        return transcoderColumns;
    }

    public void setTranscoderColumns(int transcoderColumns) {
        this.transcoderColumns = transcoderColumns;
    }

    @SuppressWarnings("unchecked")
    public static ConversionConfig fromMap(Map<String, Object> map) {
        ConversionConfig config = new ConversionConfig();
        if (map == null) {
            return config;
        }
        if (map.get("importLine") instanceof String) {
            config.setImportLine((String) map.get("importLine"));
        }
        if (map.get("nodeInputCommand") instanceof String) {
            config.setNodeInputCommand((String) map.get("nodeInputCommand"));
        }

        if (map.get("positionLookup") instanceof Map) {
            Map<String, Object> lookup = (Map<String, Object>) map.get("positionLookup");
            List<String> command = toStringList(lookup.get("command"));
            if (!command.isEmpty()) {
                config.setPositionLookupCommand(command);
            }
        }

        if (map.get("transcoder") instanceof Map) {
            Map<String, Object> transcoder = (Map<String, Object>) map.get("transcoder");
            List<String> command = toStringList(transcoder.get("command"));
            if (!command.isEmpty()) {
                config.setTranscoderCommand(command);
            }
            if (transcoder.get("columns") instanceof Number) {
                config.setTranscoderColumns(((Number) transcoder.get("columns")).intValue());
            }
        }

        return config;
    }

    private static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else if (value instanceof String) {
            for (String item : ((String) value).trim().split("\\s+")) {
                if (!item.isEmpty()) {
                    result.add(item);
                }
            }
        }
        return result;
    }
}
