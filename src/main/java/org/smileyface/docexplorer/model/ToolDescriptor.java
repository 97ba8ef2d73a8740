package org.smileyface.docexplorer.model;

import java.util.Map;

/**
 * Name, description and JSON input schema of a tool offered by the HTTP front end.
 */
public record ToolDescriptor(String name, String description, Map<String, Object> inputSchema) {
}
