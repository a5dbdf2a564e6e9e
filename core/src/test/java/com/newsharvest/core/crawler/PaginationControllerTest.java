package com.newsharvest.core.crawler;

import com.newsharvest.core.model.CrawlConfig;
import com.newsharvest.core.model.CrawlStats;
import com.newsharvest.core.model.DedupFrontier;
import com.newsharvest.core.model.SearchSession;
import com.newsharvest.core.util.Pacer;
import com.newsharvest.core.util.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static com.newsharvest.core.crawler.Fixtures.articles;
import static com.newsharvest.core.crawler.Fixtures.resultsPage;
import static org.assertj.core.api.Assertions.assertThat;

class PaginationControllerTest {

    private static final String P1 = "https://www.nrinow.news/?s=newberry";
    private static final String P2 = "https://www.nrinow.news/page/2/?s=newberry";
    private static final String P3 = "https://www.nrinow.news/page/3/?s=newberry";

    private FakeFetcher fetcher;
    private CrawlConfig cfg;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        fetcher = new FakeFetcher();
        cfg = CrawlConfig.defaults();
        sleeps = new ArrayList<>();
    }

    private PaginationController controller() {
        Sleeper recording = sleeps::add;
        PageLoader loader = new PageLoader(fetcher, new Pacer(cfg.getPacing(), recording), new CrawlStats());
        return new PaginationController(cfg, loader);
    }

    @Test
    @DisplayName("1페이지 7건 + 'Page 1 of 3' → 2페이지까지만 읽고 10건에서 멈춤")
    void page_label_scenario_stops_at_article_budget() {
        fetcher.page(P1, resultsPage(articles(1, 7), "Page 1 of 3"))
               .page(P2, resultsPage(articles(8, 7), "Page 2 of 3"))
               .page(P3, resultsPage(articles(15, 7), "Page 3 of 3"));

        List<String> urls = controller().crawl("newberry", 10, 5);

        assertThat(fetcher.requested()).containsExactly(P1, P2);
        assertThat(urls).hasSize(10).containsExactlyElementsOf(articles(1, 10));
        assertThat(new HashSet<>(urls)).hasSize(urls.size());
    }

    @Test
    void continuation_fetches_are_paced_but_first_fetch_is_not() {
        cfg.getPacing().setPageDelayMinMs(2000).setPageDelayMaxMs(4000);
        fetcher.page(P1, resultsPage(articles(1, 7), "Page 1 of 3"))
               .page(P2, resultsPage(articles(8, 7), "Page 2 of 3"));

        controller().crawl("newberry", 10, 5);

        assertThat(sleeps).hasSize(1);
        assertThat(sleeps.get(0).toMillis()).isBetween(2000L, 4000L);
    }

    @Test
    void stops_when_a_page_yields_no_new_urls() {
        fetcher.page(P1, resultsPage(articles(1, 7), "Page 1 of 3"))
               .page(P2, resultsPage(articles(1, 7), "Page 2 of 3"))   // 같은 결과 반복
               .page(P3, resultsPage(articles(20, 7), "Page 3 of 3"));

        List<String> urls = controller().crawl("newberry", 50, 5);

        assertThat(fetcher.requested()).containsExactly(P1, P2);
        assertThat(urls).containsExactlyElementsOf(articles(1, 7));
    }

    @Test
    void stops_without_continuation_evidence() {
        fetcher.page(P1, resultsPage(articles(1, 3), null))
               .page(P2, resultsPage(articles(4, 3), null));

        List<String> urls = controller().crawl("newberry", 50, 5);

        assertThat(fetcher.requested()).containsExactly(P1);
        assertThat(urls).hasSize(3);
    }

    @Test
    @DisplayName("라벨이 없어도 한 페이지를 가득 채우면 다음 페이지를 본다")
    void full_page_heuristic_continues() {
        fetcher.page(P1, resultsPage(articles(1, 7), null))
               .page(P2, resultsPage(articles(8, 2), null));

        List<String> urls = controller().crawl("newberry", 50, 5);

        assertThat(fetcher.requested()).containsExactly(P1, P2);
        assertThat(urls).hasSize(9);
    }

    @Test
    void fetch_failure_keeps_partial_results() {
        fetcher.page(P1, resultsPage(articles(1, 7), "Page 1 of 3")); // P2 없음 → 실패

        List<String> urls = controller().crawl("newberry", 50, 5);

        assertThat(fetcher.requested()).containsExactly(P1, P2);
        assertThat(urls).containsExactlyElementsOf(articles(1, 7));
    }

    @Test
    void never_visits_more_than_max_pages() {
        for (int p = 1; p <= 6; p++) {
            String url = (p == 1) ? P1 : "https://www.nrinow.news/page/" + p + "/?s=newberry";
            fetcher.page(url, resultsPage(articles(p * 100, 7), "Page " + p + " of 99"));
        }

        List<String> urls = controller().crawl("newberry", 1000, 3);

        assertThat(fetcher.requested()).hasSize(3);
        assertThat(urls).hasSize(21);
    }

    @Test
    void seeded_urls_are_never_reemitted() {
        fetcher.page(P1, resultsPage(articles(1, 5), null));
        SearchSession session = new SearchSession("newberry", 10, 5,
                new DedupFrontier(List.of(Fixtures.article(2), Fixtures.article(4))));

        List<String> urls = controller().crawl(session);

        assertThat(urls).containsExactly(Fixtures.article(1), Fixtures.article(3), Fixtures.article(5));
        assertThat(session.getPagesVisited()).isEqualTo(1);
    }

    @Test
    void no_results_returns_empty_list() {
        fetcher.page(P1, "<html><body><div class='td-main-content-wrap'>No results</div></body></html>");

        assertThat(controller().crawl("newberry", 10, 5)).isEmpty();
        assertThat(fetcher.requested()).hasSize(1);
    }
}
