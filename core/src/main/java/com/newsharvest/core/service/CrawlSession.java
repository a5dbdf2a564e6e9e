package com.newsharvest.core.service;

import com.newsharvest.core.api.IPageFetcher;
import com.newsharvest.core.crawler.ArticleLinkExtractor;
import com.newsharvest.core.crawler.PageLoader;
import com.newsharvest.core.crawler.PaginationController;
import com.newsharvest.core.http.JsoupPageFetcher;
import com.newsharvest.core.model.ArticleRecord;
import com.newsharvest.core.model.CrawlConfig;
import com.newsharvest.core.model.CrawlReport;
import com.newsharvest.core.model.CrawlRequest;
import com.newsharvest.core.model.CrawlStats;
import com.newsharvest.core.model.DedupFrontier;
import com.newsharvest.core.model.FetchedPage;
import com.newsharvest.core.model.Operation;
import com.newsharvest.core.model.SearchHit;
import com.newsharvest.core.model.SearchSession;
import com.newsharvest.core.util.Pacer;
import com.newsharvest.core.util.ProgressListener;
import com.newsharvest.core.util.Sleeper;
import com.newsharvest.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 크롤 오케스트레이터:
 *  - crawl-latest: 홈페이지 → 링크 추출 → 기사별 추출
 *  - crawl-by-keyword: 검색 페이지 순회 → 기사별 추출(+searchHit)
 *  - fetch-single-url: 기사 1건
 * 완전 순차 실행. 결과는 URL 발견 순서 그대로이며 실패한 기사도 레코드로 남는다.
 */
public final class CrawlSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlSession.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlSession.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final Sleeper sleeper;

    /** 기본 구현(JSoup fetcher, 실제 sleep) */
    public CrawlSession(CrawlConfig config) {
        this(config, new JsoupPageFetcher(config), Sleeper.THREAD);
    }

    /** DI/테스트용 */
    public CrawlSession(CrawlConfig config, IPageFetcher fetcher, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = (sleeper != null) ? sleeper : Sleeper.NONE;
    }

    /* =========================
       실행 API
       ========================= */

    public CrawlReport run(CrawlRequest request) {
        return run(request, ProgressListener.NONE);
    }

    public CrawlReport run(CrawlRequest request, ProgressListener listener) {
        Objects.requireNonNull(request, "request").validate(config.getSiteOrigin());
        ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        return switch (request.operation()) {
            case LATEST -> crawlLatest(request.maxArticles(), pl);
            case KEYWORD -> crawlByKeyword(request.keyword(), request.maxArticles(), request.maxPages(), List.of(), pl);
            case SINGLE_URL -> fetchSingleUrl(request.url(), pl);
        };
    }

    public CrawlReport crawlLatest(int maxArticles) {
        return crawlLatest(maxArticles, ProgressListener.NONE);
    }

    public CrawlReport crawlByKeyword(String keyword, int maxArticles, int maxPages) {
        return crawlByKeyword(keyword, maxArticles, maxPages, List.of(), ProgressListener.NONE);
    }

    public CrawlReport fetchSingleUrl(String url) {
        return fetchSingleUrl(url, ProgressListener.NONE);
    }

    /* =========================
       동작별 구현
       ========================= */

    public CrawlReport crawlLatest(int maxArticles, ProgressListener pl) {
        if (maxArticles < 1) throw new IllegalArgumentException("maxArticles must be >= 1");
        if (pl == null) pl = ProgressListener.NONE;
        Run run = newRun(Operation.LATEST);
        pl.onProgress(ProgressListener.Phase.SEARCH, 0, -1);

        String origin = config.getSiteOrigin();
        List<String> urls = List.of();
        int pages = 0;
        Optional<FetchedPage> home = run.loader.loadListing(URI.create(origin));
        if (home.isPresent()) {
            pages = 1;
            Document dom = Jsoup.parse(home.get().html(), origin);
            List<String> found = new ArticleLinkExtractor(origin).extractLinks(dom, origin, null);
            LOG.info("Found {} article URLs on homepage", found.size());
            urls = found.size() > maxArticles ? found.subList(0, maxArticles) : found;
        } else {
            LOG.error("Homepage could not be loaded: {}", origin);
        }
        if (urls.isEmpty()) LOG.error("No articles found");

        List<ArticleRecord> records = extractAll(run, urls, null, pl);
        return finish(run, records, pages, urls.size(), pl);
    }

    /**
     * @param alreadySeen 이전 실행에서 본 URL. 이번 결과로 다시 내보내지 않는다.
     */
    public CrawlReport crawlByKeyword(String keyword, int maxArticles, int maxPages,
                                      Collection<String> alreadySeen, ProgressListener pl) {
        if (keyword == null || keyword.isBlank()) throw new IllegalArgumentException("keyword is required");
        Run run = newRun(Operation.KEYWORD);
        ProgressListener listener = (pl != null) ? pl : ProgressListener.NONE;
        listener.onProgress(ProgressListener.Phase.SEARCH, 0, -1);

        SearchSession session = new SearchSession(keyword.trim(), maxArticles, maxPages, new DedupFrontier(alreadySeen));
        List<String> urls = new PaginationController(config, run.loader).crawl(session);
        int total = session.getFrontier().size();

        List<ArticleRecord> records = extractAll(run, urls, (rank) ->
                new SearchHit(session.getKeyword(), rank, total, session.getPagesVisited()), listener);
        records.forEach(r -> session.articleYielded());
        return finish(run, records, session.getPagesVisited(), total, listener);
    }

    public CrawlReport fetchSingleUrl(String url, ProgressListener pl) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url is required");
        if (pl == null) pl = ProgressListener.NONE;
        Run run = newRun(Operation.SINGLE_URL);
        LOG.info("Scraping single URL: {}", url);
        List<ArticleRecord> records = extractAll(run, List.of(url), null, pl);
        return finish(run, records, 0, 1, pl);
    }

    /* =========================
       공통
       ========================= */

    @FunctionalInterface
    private interface HitFactory {
        SearchHit forRank(int rank);
    }

    /** 세션 1회분 상태: 카운터 + 간격 유지(첫 fetch 는 대기 없음) */
    private static final class Run {
        final String id = UUID.randomUUID().toString().substring(0, 8);
        final Operation operation;
        final CrawlStats stats = new CrawlStats();
        final PageLoader loader;
        final ArticleProcessor processor;

        Run(Operation operation, CrawlConfig cfg, IPageFetcher fetcher, Sleeper sleeper) {
            this.operation = operation;
            this.loader = new PageLoader(fetcher, new Pacer(cfg.getPacing(), sleeper), stats);
            this.processor = new ArticleProcessor(loader, stats);
        }
    }

    private Run newRun(Operation op) {
        Run run = new Run(op, config, fetcher, sleeper);
        SLOG.forSession(run.id).emit(StructuredLog.Event.CRAWL_START,
                "operation", op.label(), "origin", config.getSiteOrigin());
        return run;
    }

    private List<ArticleRecord> extractAll(Run run, List<String> urls, HitFactory hits, ProgressListener pl) {
        List<ArticleRecord> out = new ArrayList<>(urls.size());
        int total = urls.size();
        pl.onProgress(ProgressListener.Phase.EXTRACT, 0, total);
        for (int i = 0; i < total; i++) {
            String url = urls.get(i);
            LOG.info("Scraping {}/{}: {}", i + 1, total, url);
            ArticleRecord rec = run.processor.process(url);
            if (hits != null) rec = rec.withSearchHit(hits.forRank(i + 1));
            if (!rec.isSuccess()) LOG.warn("Failed: {} ({})", url, rec.getError());
            out.add(rec);
            pl.onProgress(ProgressListener.Phase.EXTRACT, i + 1, total);
        }
        return out;
    }

    private CrawlReport finish(Run run, List<ArticleRecord> records, int pages, int discovered, ProgressListener pl) {
        CrawlReport report = new CrawlReport(run.operation, records, pages, discovered, run.stats.snapshot());
        LOG.info("Crawl done. operation={}, succeeded={}/{}, pages={}, discovered={}",
                run.operation.label(), report.succeeded(), report.attempted(), pages, discovered);
        SLOG.forSession(run.id).emit(StructuredLog.Event.CRAWL_DONE,
                "operation", run.operation.label(),
                "attempted", report.attempted(),
                "succeeded", report.succeeded(),
                "pages", pages,
                "discovered", discovered,
                "fetchFailures", report.stats().fetchFailures(),
                "challengePages", report.stats().challengePages());
        pl.onProgress(ProgressListener.Phase.DONE, report.attempted(), report.attempted());
        return report;
    }

    @Override
    public void close() throws Exception {
        fetcher.close();
    }
}
