package org.smileyface.docexplorer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate returned to the caller of an exploration. Always has the same shape: failures are
 * reported through {@link #getError()} next to whatever content was gathered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rootUrl", "explorationDepth", "pagesExplored", "content", "error"})
public final class ExplorationResult {

    private final String rootUrl;
    private final int explorationDepth;
    private final List<PageResult> content;
    private final String error;
    private final ExplorationState state;

    public ExplorationResult(String rootUrl, int explorationDepth, List<PageResult> content,
                             String error, ExplorationState state) {
        this.rootUrl = rootUrl;
        this.explorationDepth = explorationDepth;
        this.content = content == null ? List.of() : List.copyOf(content);
        this.error = (error == null || error.isBlank()) ? null : error;
        this.state = Objects.requireNonNull(state, "state");
    }

    public static ExplorationResult completed(String rootUrl, int depth, List<PageResult> pages) {
        return new ExplorationResult(rootUrl, depth, pages, null, ExplorationState.COMPLETED);
    }

    public static ExplorationResult timedOut(String rootUrl, int depth, List<PageResult> pages, String error) {
        return new ExplorationResult(rootUrl, depth, pages, error, ExplorationState.TIMED_OUT);
    }

    public static ExplorationResult failed(String rootUrl, int depth, String error) {
        return new ExplorationResult(rootUrl, depth, List.of(), error, ExplorationState.FAILED);
    }

    public String getRootUrl() { return rootUrl; }

    public int getExplorationDepth() { return explorationDepth; }

    /** Number of pages that were fetched and extracted successfully. */
    public int getPagesExplored() { return content.size(); }

    public List<PageResult> getContent() { return content; }

    public String getError() { return error; }

    @JsonIgnore
    public ExplorationState getState() { return state; }

    /** A hard failure: nothing could be gathered for the request. */
    @JsonIgnore
    public boolean isFailure() { return state == ExplorationState.FAILED; }

    @Override
    public String toString() {
        return "ExplorationResult{" +
                "rootUrl='" + rootUrl + '\'' +
                ", explorationDepth=" + explorationDepth +
                ", pagesExplored=" + content.size() +
                ", state=" + state +
                ", error='" + error + '\'' +
                '}';
    }
}
