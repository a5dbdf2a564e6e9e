package com.newsharvest.core.crawler;

import com.newsharvest.core.api.ISearchCrawler;
import com.newsharvest.core.model.CrawlConfig;
import com.newsharvest.core.model.DedupFrontier;
import com.newsharvest.core.model.FetchedPage;
import com.newsharvest.core.model.SearchSession;
import com.newsharvest.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 검색 결과 페이지 순회기.
 * 종료: 기사 상한 도달 / 페이지 상한 도달 / 새 URL 0건 / 다음 페이지 근거 없음 / 페이지 fetch 실패.
 * 다음 페이지 판단은 NextPageSignal 들의 OR.
 */
public class PaginationController implements ISearchCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(PaginationController.class);
    private static final StructuredLog SLOG = StructuredLog.get(PaginationController.class);

    private final SearchUrlBuilder urls;
    private final ArticleLinkExtractor extractor;
    private final List<NextPageSignal> signals;
    private final PageLoader loader;

    public PaginationController(CrawlConfig config, PageLoader loader) {
        this(new SearchUrlBuilder(config.getSiteOrigin()),
                new ArticleLinkExtractor(config.getSiteOrigin()),
                defaultSignals(config.getNominalPerPage()),
                loader);
    }

    public PaginationController(SearchUrlBuilder urls, ArticleLinkExtractor extractor,
                                List<NextPageSignal> signals, PageLoader loader) {
        this.urls = Objects.requireNonNull(urls, "urls");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.signals = List.copyOf(signals);
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public static List<NextPageSignal> defaultSignals(int nominalPerPage) {
        return List.of(new PageOfLabelSignal(), new PageNavLinkSignal(),
                new SearchContextLinkSignal(), new FullPageSignal(nominalPerPage));
    }

    @Override
    public List<String> crawl(String keyword, int maxArticles, int maxPages) {
        return crawl(new SearchSession(keyword, maxArticles, maxPages));
    }

    /**
     * 세션 컨텍스트로 순회. 프런티어에 seed 된 URL 은 다시 내보내지 않는다.
     * 반환은 발견 순서, maxArticles 개로 잘림.
     */
    public List<String> crawl(SearchSession session) {
        DedupFrontier frontier = session.getFrontier();
        String keyword = session.getKeyword();
        StructuredLog slog = SLOG.forSession(session.getSessionId());
        LOG.info("Searching for '{}' (max {} articles, {} pages) [session {}]",
                keyword, session.getMaxArticles(), session.getMaxPages(), session.getSessionId());

        int pageNum = 1;
        while (!session.articleBudgetReached() && !session.pageBudgetReached()) {
            URI pageUrl = urls.page(keyword, pageNum);
            LOG.info("Checking search page {}: {}", pageNum, pageUrl);

            Optional<FetchedPage> page = loader.loadListing(pageUrl);
            if (page.isEmpty()) {
                LOG.warn("Failed to load search page {}", pageNum);
                break;
            }
            session.pageVisited();

            Document dom = Jsoup.parse(page.get().html(), pageUrl.toString());
            List<String> found = extractor.extractLinks(dom, pageUrl.toString(), frontier.excludeView());
            int fresh = 0;
            for (String u : found) {
                if (frontier.offer(u)) fresh++;
            }
            slog.emit(StructuredLog.Event.SEARCH_PAGE, "page", pageNum,
                    "found", fresh, "total", frontier.size());

            if (fresh == 0) {
                LOG.info("No more articles found on page {}, stopping search", pageNum);
                break;
            }
            LOG.info("Found {} articles on page {} (total: {})", fresh, pageNum, frontier.size());

            PageContext ctx = new PageContext(dom, pageNum, fresh, session.getMaxPages());
            String evidence = continuationEvidence(ctx);
            if (evidence == null) {
                LOG.info("No more pages detected after page {}", pageNum);
                break;
            }
            LOG.debug("Next page evidence on page {}: {}", pageNum, evidence);
            pageNum++;
        }

        List<String> all = frontier.discovered();
        if (all.isEmpty()) {
            LOG.warn("No search results found for keyword: '{}'", keyword);
            return List.of();
        }
        List<String> limited = all.size() > session.getMaxArticles()
                ? all.subList(0, session.getMaxArticles())
                : all;
        LOG.info("Found {} total search results, keeping {}", all.size(), limited.size());
        return List.copyOf(limited);
    }

    /** 첫 번째로 참인 신호의 이름, 없으면 null */
    String continuationEvidence(PageContext ctx) {
        for (NextPageSignal s : signals) {
            if (s.hasNext(ctx)) return s.name();
        }
        return null;
    }
}
