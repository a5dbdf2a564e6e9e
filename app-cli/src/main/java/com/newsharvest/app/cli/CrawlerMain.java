package com.newsharvest.app.cli;

import com.newsharvest.app.logging.LogSetup;
import com.newsharvest.core.model.CrawlConfig;
import com.newsharvest.core.model.CrawlReport;
import com.newsharvest.core.model.CrawlRequest;
import com.newsharvest.core.service.CrawlSession;
import com.newsharvest.core.service.export.ArticleExporter;
import com.newsharvest.core.service.export.JsonArticleExporter;
import com.newsharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI 진입점.
 * <pre>
 *   crawler                                  # 홈페이지 최신 기사
 *   crawler --search "newberry" --max-pages 5
 *   crawler --url https://www.nrinow.news/2025/...
 * </pre>
 * 종료 코드: 0 성공(부분 실패 포함), 2 잘못된 인자, 1 실행 오류.
 */
@Command(name = "crawler", mixinStandardHelpOptions = true, version = "newsharvest 0.3.0",
        description = "Crawls nrinow.news articles (latest, keyword search or a single URL) into JSON.")
public class CrawlerMain implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlerMain.class);

    static final int EXIT_USAGE = 2;
    static final int EXIT_ERROR = 1;

    @Spec
    CommandSpec spec;

    @Option(names = "--search", paramLabel = "KEYWORD", description = "Search for articles containing this keyword")
    String search;

    @Option(names = "--url", paramLabel = "URL", description = "Scrape a specific article URL directly")
    String url;

    @Option(names = "--max-articles", paramLabel = "N", description = "Maximum number of articles (default: crawl.yml, 3)")
    Integer maxArticles;

    @Option(names = "--max-pages", paramLabel = "N", description = "Maximum search result pages to check (default: crawl.yml, 15)")
    Integer maxPages;

    @Option(names = "--output-dir", paramLabel = "DIR", description = "Directory to save results")
    Path outputDir;

    @Option(names = "--separate-files", description = "Save each article as a separate JSON file")
    boolean separateFiles;

    @Option(names = "--config", paramLabel = "FILE", description = "crawl.yml to use instead of the default")
    Path configFile;

    private final Function<CrawlConfig, CrawlSession> sessionFactory;

    public CrawlerMain() {
        this(CrawlSession::new);
    }

    /** 테스트용: fetcher 를 바꿔 끼운 세션 주입 */
    CrawlerMain(Function<CrawlConfig, CrawlSession> sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CrawlerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CrawlConfig cfg;
        CrawlRequest request;
        try {
            cfg = loadConfig();
            request = CrawlRequest.resolve(search, url,
                    maxArticles != null ? maxArticles : cfg.getMaxArticles(),
                    maxPages != null ? maxPages : cfg.getMaxPages())
                    .validate(cfg.getSiteOrigin());
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        LogSetup.configure(cfg.getOutputDir());
        out.println("News harvest for " + cfg.getSiteOrigin());
        out.println("=".repeat(40));
        switch (request.operation()) {
            case KEYWORD -> out.println("Search: '" + request.keyword() + "'");
            case SINGLE_URL -> out.println("URL: " + request.url());
            case LATEST -> out.println("Latest articles");
        }

        Instant started = Instant.now();
        try (CrawlSession session = sessionFactory.apply(cfg)) {
            CrawlReport report = session.run(request, (phase, done, total) ->
                    LOG.debug("progress phase={} {}/{}", phase, done, total));

            ArticleExporter exporter = new JsonArticleExporter(cfg.isSeparateFiles());
            List<Path> files = exporter.export(cfg.getOutputDir(), request, report, started);

            SummaryPrinter summary = new SummaryPrinter(out);
            summary.printFiles(files, cfg.isSeparateFiles());
            summary.printReport(report);
            return 0;
        } catch (Exception e) {
            LOG.error("Crawl failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    /** --config 파일 또는 기본값에 CLI 덮어쓰기 적용 */
    CrawlConfig loadConfig() throws IOException {
        CrawlConfig cfg = (configFile != null) ? YamlConfigLoader.load(configFile) : YamlConfigLoader.loadDefault();
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (separateFiles) cfg.setSeparateFiles(true);
        cfg.validate();
        return cfg;
    }
}
