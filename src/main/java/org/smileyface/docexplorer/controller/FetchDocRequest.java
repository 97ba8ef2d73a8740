package org.smileyface.docexplorer.controller;

/**
 * Arguments of the {@code fetch_doc_content} tool. {@code depth} is optional.
 */
public record FetchDocRequest(String url, Integer depth) {
}
