package com.newsharvest.core.service;

import com.newsharvest.core.crawler.PageLoader;
import com.newsharvest.core.extract.CommentExtractor;
import com.newsharvest.core.extract.ContentExtractor;
import com.newsharvest.core.extract.ImageExtractor;
import com.newsharvest.core.model.ArticleRecord;
import com.newsharvest.core.model.CrawlStats;
import com.newsharvest.core.model.FetchedPage;
import com.newsharvest.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * 기사 1건: fetch → parse → 본문/이미지/댓글 추출 → ArticleRecord.
 * 이 메서드가 기사 경계다. 여기서 나가는 예외는 없다(실패 레코드로 변환).
 */
public final class ArticleProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ArticleProcessor.class);
    private static final StructuredLog SLOG = StructuredLog.get(ArticleProcessor.class);

    private final PageLoader loader;
    private final ContentExtractor content;
    private final ImageExtractor images;
    private final CommentExtractor comments;
    private final CrawlStats stats;

    public ArticleProcessor(PageLoader loader, CrawlStats stats) {
        this(loader, new ContentExtractor(), new ImageExtractor(), new CommentExtractor(), stats);
    }

    public ArticleProcessor(PageLoader loader, ContentExtractor content, ImageExtractor images,
                            CommentExtractor comments, CrawlStats stats) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.content = Objects.requireNonNull(content, "content");
        this.images = Objects.requireNonNull(images, "images");
        this.comments = Objects.requireNonNull(comments, "comments");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public ArticleRecord process(String url) {
        stats.articleAttempted();

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            stats.extractionFailed();
            SLOG.emit(StructuredLog.Event.ARTICLE_BAD_URL, e, "url", url);
            return ArticleRecord.failure(url, e.getMessage());
        }

        Optional<FetchedPage> page = loader.loadArticle(uri);
        if (page.isEmpty()) {
            return ArticleRecord.failure(url, ArticleRecord.LOAD_FAILED);
        }
        return extract(page.get(), url);
    }

    /** 이미 받아 둔 페이지에서 추출(테스트/재처리용) */
    public ArticleRecord extract(FetchedPage page, String url) {
        try {
            Document dom = Jsoup.parse(page.html(), url);
            ArticleRecord base = content.extractArticle(dom, url);
            ArticleRecord rec = base.toBuilder()
                    .images(images.extractImages(dom, url))
                    .comments(comments.extractComments(dom))
                    .build();

            stats.articleSucceeded();
            LOG.info("Extracted article: {} ({} chars)", abbreviate(rec.getTitle()), rec.getBodyLength());
            SLOG.emit(StructuredLog.Event.ARTICLE_EXTRACTED, "url", url, "chars", rec.getBodyLength(),
                    "images", rec.getImages().size(), "comments", rec.getRealCommentCount());
            return rec;
        } catch (RuntimeException e) {
            stats.extractionFailed();
            LOG.error("Content extraction error on {}: {}", url, e.toString());
            SLOG.emit(StructuredLog.Event.ARTICLE_FAILED, e, "url", url);
            String msg = (e.getMessage() != null) ? e.getMessage() : e.getClass().getSimpleName();
            return ArticleRecord.failure(url, msg);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 50 ? s : s.substring(0, 50) + "...";
    }
}
