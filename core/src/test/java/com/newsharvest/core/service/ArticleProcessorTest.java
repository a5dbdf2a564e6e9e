package com.newsharvest.core.service;

import com.newsharvest.core.crawler.FakeFetcher;
import com.newsharvest.core.crawler.PageLoader;
import com.newsharvest.core.extract.ClassTokenStrategy;
import com.newsharvest.core.extract.CommentExtractor;
import com.newsharvest.core.extract.ContentExtractor;
import com.newsharvest.core.extract.ImageExtractor;
import com.newsharvest.core.extract.TextFieldStrategy;
import com.newsharvest.core.model.ArticleRecord;
import com.newsharvest.core.model.CrawlConfig;
import com.newsharvest.core.model.CrawlStats;
import com.newsharvest.core.util.Pacer;
import com.newsharvest.core.util.Sleeper;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleProcessorTest {

    private static final String URL = "https://www.nrinow.news/2025/03/20/story/";

    @Test
    void extraction_exception_becomes_failure_record() {
        TextFieldStrategy broken = new TextFieldStrategy() {
            @Override public String name() { return "broken"; }
            @Override public Optional<String> extract(Element root) {
                throw new IllegalStateException("unexpected markup");
            }
        };
        ContentExtractor content = new ContentExtractor(List.of(ClassTokenStrategy.title()), List.of(broken),
                List.of(ClassTokenStrategy.author()), List.of(ClassTokenStrategy.date()), 100);

        FakeFetcher fetcher = new FakeFetcher().page(URL, CrawlSessionTest.articleHtml("Title"));
        CrawlStats stats = new CrawlStats();
        PageLoader loader = new PageLoader(fetcher, new Pacer(CrawlConfig.Pacing.none(), Sleeper.NONE), stats);
        ArticleProcessor processor = new ArticleProcessor(loader, content, new ImageExtractor(), new CommentExtractor(), stats);

        ArticleRecord r = processor.process(URL);

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getError()).isEqualTo("unexpected markup");
        assertThat(r.getBodyText()).isEmpty();
        assertThat(stats.snapshot().extractionFailures()).isEqualTo(1);
        assertThat(stats.snapshot().articlesAttempted()).isEqualTo(1);
    }
}
