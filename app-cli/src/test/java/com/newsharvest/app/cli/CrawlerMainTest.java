package com.newsharvest.app.cli;

import com.newsharvest.core.api.IPageFetcher;
import com.newsharvest.core.model.FetchedPage;
import com.newsharvest.core.service.CrawlSession;
import com.newsharvest.core.util.Sleeper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlerMainTest {

    private static final String ARTICLE = "https://www.nrinow.news/2025/03/20/budget-vote/";

    private final Map<String, String> pages = new HashMap<>();
    private final List<String> requested = new ArrayList<>();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeAll
    static void quietConsole() {
        System.setProperty("nh.log.console", "false");
    }

    private final IPageFetcher fetcher = url -> {
        requested.add(url.toString());
        String html = pages.get(url.toString());
        return html == null ? Optional.empty() : Optional.of(new FetchedPage(url, html, Instant.now()));
    };

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new CrawlerMain(cfg -> new CrawlSession(cfg, fetcher, Sleeper.NONE)));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private static String article(String title) {
        return """
                <html><head><meta property="og:image" content="/wp-content/uploads/hero.jpg"></head><body>
                <h1 class="entry-title">%s</h1>
                <span class="td-post-author-name">Jane Reporter</span>
                <time class="entry-date">March 20, 2025</time>
                <div class="td-post-content"><p>%s</p></div>
                </body></html>
                """.formatted(title, "The council met on Tuesday night to debate the new municipal budget. ".repeat(3));
    }

    @Test
    void url_and_search_together_is_a_usage_error() {
        int code = run("--url", ARTICLE, "--search", "budget");

        assertThat(code).isEqualTo(CrawlerMain.EXIT_USAGE);
        assertThat(err.toString()).contains("Error:").contains("pick one");
        assertThat(requested).isEmpty();
    }

    @Test
    void url_from_another_site_is_rejected() {
        int code = run("--url", "https://example.com/2025/01/01/story/");

        assertThat(code).isEqualTo(CrawlerMain.EXIT_USAGE);
        assertThat(err.toString()).contains("URL must be from https://www.nrinow.news/");
        assertThat(requested).isEmpty();
    }

    @Test
    void non_positive_limits_are_rejected() {
        assertThat(run("--search", "budget", "--max-articles", "0")).isEqualTo(CrawlerMain.EXIT_USAGE);
        assertThat(err.toString()).contains("maxArticles must be >= 1");
    }

    @Test
    void single_url_is_extracted_and_saved(@TempDir Path dir) throws Exception {
        pages.put(ARTICLE, article("Budget Vote Tonight"));

        int code = run("--url", ARTICLE, "--output-dir", dir.toString());

        assertThat(code).isZero();
        assertThat(requested).containsExactly(ARTICLE);
        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).toList();
            assertThat(names).anyMatch(n -> n.matches("results_single_url_\\d{8}_\\d{6}\\.json"));
        }
        assertThat(out.toString())
                .contains("SUMMARY: 1/1 articles scraped")
                .contains("1. Budget Vote Tonight")
                .contains("Author: Jane Reporter")
                .contains("Images: 1");
    }

    @Test
    void keyword_search_with_separate_files(@TempDir Path dir) throws Exception {
        pages.put("https://www.nrinow.news/?s=budget", """
                <html><body><div class="td-main-content-wrap">
                <h3 class="entry-title"><a href="%s">Budget Vote Tonight</a></h3>
                </div></body></html>
                """.formatted(ARTICLE));
        pages.put(ARTICLE, article("Budget Vote Tonight"));

        int code = run("--search", "budget", "--max-articles", "5", "--max-pages", "2",
                "--output-dir", dir.toString(), "--separate-files");

        assertThat(code).isZero();
        assertThat(requested).containsExactly("https://www.nrinow.news/?s=budget", ARTICLE);
        assertThat(dir.resolve("Budget_Vote_Tonight_20250320_001.json")).exists();
        assertThat(out.toString())
                .contains("Saved 1 individual article files")
                .contains("(Rank #1/1, 1 pages)");
    }

    @Test
    void failed_fetch_is_reported_not_fatal(@TempDir Path dir) {
        int code = run("--url", ARTICLE, "--output-dir", dir.toString());

        assertThat(code).isZero();
        assertThat(out.toString()).contains("SUMMARY: 0/1 articles scraped").contains("FAILED: Failed to load page");
    }
}
