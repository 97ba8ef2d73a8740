package org.smileyface.docexplorer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ExplorationResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void json_hasStableShapeWithoutInternalFields() throws Exception {
        PageResult page = new PageResult(URI.create("https://docs.test/"), "  ", "Text",
                List.of(new LinkCandidate(URI.create("https://docs.test/a"), "A", 3.5)));
        ExplorationResult result = ExplorationResult.completed("https://docs.test/", 2, List.of(page));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(fieldNames(json)).containsExactly("rootUrl", "explorationDepth", "pagesExplored", "content");
        JsonNode first = json.get("content").get(0);
        assertThat(fieldNames(first)).containsExactly("url", "content", "links");
        assertThat(fieldNames(first.get("links").get(0))).containsExactly("url", "text");
        assertThat(json.get("pagesExplored").asInt()).isEqualTo(1);
    }

    @Test
    void failed_hasErrorAndNoContent() throws Exception {
        ExplorationResult result = ExplorationResult.failed("x", 1, "Invalid URL provided: x");

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getState()).isEqualTo(ExplorationState.FAILED);
        assertThat(json.get("error").asText()).isEqualTo("Invalid URL provided: x");
        assertThat(json.get("content")).isEmpty();
        assertThat(json.get("pagesExplored").asInt()).isZero();
    }

    @Test
    void timedOut_isPartialNotFailure() {
        ExplorationResult result = ExplorationResult.timedOut("x", 2, List.of(), "Exploration timed out");
        assertThat(result.isFailure()).isFalse();
        assertThat(result.getState().isTerminal()).isTrue();
    }

    @Test
    void toolResponse_serializesIsErrorFlag() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(ToolResponse.error("boom")));

        assertThat(json.get("isError").asBoolean()).isTrue();
        assertThat(json.get("content").get(0).get("type").asText()).isEqualTo("text");
        assertThat(json.get("content").get(0).get("text").asText()).isEqualTo("boom");
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
            names.add(it.next());
        }
        return names;
    }
}
