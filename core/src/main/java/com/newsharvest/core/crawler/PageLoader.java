package com.newsharvest.core.crawler;

import com.newsharvest.core.api.IPageFetcher;
import com.newsharvest.core.http.ChallengeDetector;
import com.newsharvest.core.model.CrawlStats;
import com.newsharvest.core.model.FetchedPage;
import com.newsharvest.core.util.Pacer;
import com.newsharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * fetcher 앞단: 간격 유지 → fetch → 차단 마커 경고 → 카운터 갱신.
 * 한 번에 하나의 fetch 만 진행(순차).
 */
public final class PageLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PageLoader.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageLoader.class);

    private final IPageFetcher fetcher;
    private final Pacer pacer;
    private final CrawlStats stats;

    public PageLoader(IPageFetcher fetcher, Pacer pacer, CrawlStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /** 검색 결과/홈 페이지 */
    public Optional<FetchedPage> loadListing(URI url) {
        try {
            pacer.beforePageFetch();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        Optional<FetchedPage> page = fetchOnce(url, "listing");
        if (page.isPresent()) stats.pageFetched();
        return page;
    }

    /** 기사 페이지 */
    public Optional<FetchedPage> loadArticle(URI url) {
        try {
            pacer.beforeArticleFetch();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        return fetchOnce(url, "article");
    }

    private Optional<FetchedPage> fetchOnce(URI url, String kind) {
        LOG.info("Loading {} ({})", url, kind);
        Optional<FetchedPage> page;
        try {
            page = fetcher.fetch(url);
        } catch (RuntimeException e) {
            // 계약 위반(예외) 도 실패로 취급
            SLOG.emit(StructuredLog.Event.FETCH_THREW, e, "url", String.valueOf(url), "kind", kind);
            page = Optional.empty();
        }
        if (page == null || page.isEmpty()) {
            stats.fetchFailed();
            SLOG.emit(StructuredLog.Event.FETCH_FAILED, "url", String.valueOf(url), "kind", kind);
            return Optional.empty();
        }

        List<String> markers = ChallengeDetector.markers(page.get().html());
        if (!markers.isEmpty()) {
            stats.challengeSeen();
            LOG.warn("Potential blocks detected on {}: {}", url, markers);
            SLOG.emit(StructuredLog.Event.CHALLENGE_MARKERS, "url", String.valueOf(url), "markers", String.join("|", markers));
        }
        LOG.debug("Loaded {}: {} chars", url, page.get().html().length());
        return page;
    }
}
