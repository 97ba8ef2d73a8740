package org.smileyface.docexplorer.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.model.ExplorationResult;
import org.smileyface.docexplorer.model.ToolDescriptor;
import org.smileyface.docexplorer.model.ToolResponse;
import org.smileyface.docexplorer.service.DocExplorerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool-style HTTP front end: lists the available tool and executes {@code fetch_doc_content}.
 */
@RestController
class ExploreController {

    private static final Logger log = LoggerFactory.getLogger(ExploreController.class);

    static final String FETCH_DOC_CONTENT = "fetch_doc_content";
    static final String ERROR_PREFIX = "Error fetching content: ";

    private final DocExplorerService explorer;
    private final ExplorerProperties properties;
    private final ObjectWriter prettyWriter;

    ExploreController(DocExplorerService explorer, ExplorerProperties properties, ObjectMapper objectMapper) {
        this.explorer = explorer;
        this.properties = properties;
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
    }

    @GetMapping("/tools")
    public Map<String, List<ToolDescriptor>> tools() {
        return Map.of("tools", List.of(fetchDocContentTool()));
    }

    @PostMapping("/tools/{name}")
    public ResponseEntity<ToolResponse> call(@PathVariable String name,
                                             @RequestBody(required = false) FetchDocRequest request) {
        if (!FETCH_DOC_CONTENT.equals(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ToolResponse.error("Unknown tool: " + name));
        }
        String url = request == null ? null : request.url();
        int depth = properties.clampDepth(request == null ? null : request.depth());
        log.info("Tool {} called for {} (depth {})", name, url, depth);

        ExplorationResult result = explorer.explore(url, depth);
        if (result.isFailure()) {
            return ResponseEntity.ok(ToolResponse.error(errorText(result.getError())));
        }
        try {
            return ResponseEntity.ok(ToolResponse.text(prettyWriter.writeValueAsString(result)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize exploration result for {}", url, e);
            return ResponseEntity.ok(ToolResponse.error(ERROR_PREFIX + e.getOriginalMessage()));
        }
    }

    private static String errorText(String error) {
        if (error == null) return ERROR_PREFIX + "unknown error";
        return error.startsWith(ERROR_PREFIX) ? error : ERROR_PREFIX + error;
    }

    private ToolDescriptor fetchDocContentTool() {
        Map<String, Object> url = new LinkedHashMap<>();
        url.put("type", "string");
        url.put("description", "URL of the documentation page to fetch");

        Map<String, Object> depth = new LinkedHashMap<>();
        depth.put("type", "integer");
        depth.put("description", "How many link levels to explore; 1 fetches the page only");
        depth.put("minimum", 1);
        depth.put("maximum", properties.getMaxDepthLimit());
        depth.put("default", properties.getDefaultDepth());

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("url", url);
        props.put("depth", depth);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        schema.put("required", List.of("url"));

        return new ToolDescriptor(FETCH_DOC_CONTENT,
                "Fetches a documentation page and the most relevant pages it links to on the same site, "
                        + "returning their text content and links as JSON",
                schema);
    }
}
