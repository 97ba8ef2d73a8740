package org.smileyface.docexplorer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Tool-call response wrapper returned by the HTTP front end: a list of text parts plus an error flag.
 */
public record ToolResponse(List<TextContent> content, @JsonProperty("isError") boolean isError) {

    public static ToolResponse text(String text) {
        return new ToolResponse(List.of(new TextContent(text)), false);
    }

    public static ToolResponse error(String text) {
        return new ToolResponse(List.of(new TextContent(text)), true);
    }

    public record TextContent(String type, String text) {
        public TextContent(String text) {
            this("text", text);
        }
    }
}
