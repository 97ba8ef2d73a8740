package org.smileyface.docexplorer.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.docexplorer.model.ExplorationResult;
import org.smileyface.docexplorer.model.ExplorationState;
import org.smileyface.docexplorer.model.LinkCandidate;
import org.smileyface.docexplorer.model.PageResult;
import org.smileyface.docexplorer.testutil.PageServer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.*;
import static org.smileyface.docexplorer.testutil.PageServer.article;
import static org.smileyface.docexplorer.testutil.PageServer.link;

/**
 * End-to-end tests for DocExplorerService using a lightweight in-memory HTTP server
 * that serves multiple generated HTML pages. Rendered fetching is disabled in the test profile.
 */
@SpringBootTest
@ActiveProfiles("test")
class DocExplorerServiceTest {

    Logger logger = LogManager.getLogger(DocExplorerServiceTest.class);

    private PageServer server;

    @Autowired
    private DocExplorerService explorer;

    @BeforeEach
    void startServer() throws Exception {
        server = PageServer.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
    }

    @Test
    void explore_invalidUrl_failsWithoutFetching() {
        ExplorationResult result = explorer.explore("ftp://files.test/readme", 2);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getError()).isEqualTo("Invalid URL provided: ftp://files.test/readme");
        assertThat(result.getPagesExplored()).isZero();
        assertThat(result.getExplorationDepth()).isEqualTo(2);
    }

    @Test
    void explore_depthBelowOne_isTreatedAsOne() {
        server.page("/", article("Root", link("/a", "Page A")));
        server.page("/a", article("A"));

        ExplorationResult result = explorer.explore(server.url("/"), 0);

        assertThat(result.getExplorationDepth()).isEqualTo(1);
        assertThat(result.getPagesExplored()).isEqualTo(1);
    }

    @Test
    void explore_singlePageSite_returnsOnePageAtAnyDepth() {
        server.page("/", article("Only page"));

        ExplorationResult result = explorer.explore(server.url("/"), 3);

        assertThat(result.getState()).isEqualTo(ExplorationState.COMPLETED);
        assertThat(result.getPagesExplored()).isEqualTo(1);
        assertThat(result.getContent().get(0).getTitle()).isEqualTo("Only page");
        assertThat(result.getContent().get(0).getContent()).contains(PageServer.FILLER);
    }

    @Test
    void explore_childrenFailing_excludedFromResultWithoutTopLevelError() {
        String external = "http://127.0.0.1:" + server.port() + "/external";
        server.page("/", article("Root",
                link("/c1", "Child page A"), link("/c2", "Child page B"), link("/c3", "Child page C"),
                link("/c4", "Child page D"), link("/c5", "Child page E"),
                link(external, "External reference")));
        // /c2 and /c4 answer 404; /c3 is also linked from /c1
        server.page("/c1", article("C1", link("/c3", "Child page C")));
        server.page("/c3", article("C3"));
        server.page("/c5", article("C5"));

        ExplorationResult result = explorer.explore(server.url("/"), 2);
        logger.info("result: {}", result);

        assertThat(result.getError()).isNull();
        assertThat(result.getPagesExplored()).isEqualTo(4);
        assertThat(result.getContent()).extracting(p -> p.getUrl().getPath())
                .containsExactly("/", "/c1", "/c3", "/c5");

        PageResult root = result.getContent().get(0);
        assertThat(root.getLinks()).extracting(l -> l.getUrl().toString()).contains(external);
        assertThat(server.requestedPaths()).doesNotContain("/external");
        assertThat(server.requestedPaths()).filteredOn("/c3"::equals).hasSize(1);
    }

    @Test
    void explore_depthThree_followsGrandchildrenOnSameSite() {
        server.page("/", article("Root", link("/guide", "User guide")));
        server.page("/guide", article("Guide", link("/guide/install", "Installation guide")));
        server.page("/guide/install", article("Install", link("/guide/install/linux", "Linux")));
        server.page("/guide/install/linux", article("Linux"));

        ExplorationResult result = explorer.explore(server.url("/"), 3);

        assertThat(result.getContent()).extracting(p -> p.getUrl().getPath())
                .containsExactly("/", "/guide", "/guide/install");
        assertThat(server.requestedPaths()).doesNotContain("/guide/install/linux");
    }

    @Test
    void explore_unreachableRoot_isFailureWithReason() {
        ExplorationResult result = explorer.explore(server.url("/missing"), 2);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getPagesExplored()).isZero();
        assertThat(result.getError()).startsWith("Error fetching content: HTTP 404");
    }

    @Test
    void explore_linksCarryTextAndAbsoluteUrls() {
        server.page("/docs/", article("Docs", link("intro", "Introduction"), link("/about", "About")));
        server.page("/docs/intro", article("Intro"));

        ExplorationResult result = explorer.explore(server.url("/docs/"), 1);

        assertThat(result.getContent().get(0).getLinks())
                .extracting(LinkCandidate::getText, l -> l.getUrl().toString())
                .containsExactly(tuple("Introduction", server.url("/docs/intro")));
    }
}
