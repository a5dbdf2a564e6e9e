package com.newsharvest.core.extract;

import com.newsharvest.core.model.ArticleRecord;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 기사 DOM → 제목/본문/작성자/날짜.
 * 필드마다 전략 체인을 순서대로 시도한다. 못 찾은 필드는 센티널("No title found", "Unknown").
 * 이미지/댓글은 ImageExtractor/CommentExtractor 몫.
 */
public final class ContentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentExtractor.class);

    /** 본문 최소 길이(미만이면 빈 껍데기/플레이스홀더로 보고 다음 후보로) */
    public static final int MIN_BODY_CHARS = 100;

    public static final List<String> BODY_SELECTORS = List.of(
            ".pf-content",        // 사이트 전용
            ".td-post-content",
            ".entry-content",
            ".post-content",
            ".article-content",
            "[class*=content]",
            "article",
            ".post");

    private final List<TextFieldStrategy> titleChain;
    private final List<TextFieldStrategy> bodyChain;
    private final List<TextFieldStrategy> authorChain;
    private final List<TextFieldStrategy> dateChain;
    private final int minBodyChars;

    public ContentExtractor() {
        this(List.of(ClassTokenStrategy.title()),
                BODY_SELECTORS.stream().<TextFieldStrategy>map(ContainerTextStrategy::new).toList(),
                List.of(ClassTokenStrategy.author()),
                List.of(ClassTokenStrategy.date()),
                MIN_BODY_CHARS);
    }

    public ContentExtractor(List<TextFieldStrategy> titleChain,
                            List<TextFieldStrategy> bodyChain,
                            List<TextFieldStrategy> authorChain,
                            List<TextFieldStrategy> dateChain,
                            int minBodyChars) {
        this.titleChain = List.copyOf(titleChain);
        this.bodyChain = List.copyOf(bodyChain);
        this.authorChain = List.copyOf(authorChain);
        this.dateChain = List.copyOf(dateChain);
        this.minBodyChars = minBodyChars;
    }

    /**
     * 성공 레코드(success=true)를 만든다. 예외는 호출자(기사 경계)에서 실패 레코드로 바뀐다.
     */
    public ArticleRecord extractArticle(Document dom, String url) {
        Objects.requireNonNull(dom, "dom");
        String title = first(titleChain, dom).orElse(ArticleRecord.NO_TITLE);
        String body = body(dom);
        String author = first(authorChain, dom).orElse(ArticleRecord.UNKNOWN);
        String date = first(dateChain, dom).orElse(ArticleRecord.UNKNOWN);

        LOG.debug("Extracted '{}' ({} chars) from {}", abbreviate(title, 50), body.length(), url);
        return ArticleRecord.builder()
                .url(url)
                .success(true)
                .title(title)
                .bodyText(body)
                .author(author)
                .publishDateRaw(date)
                .build();
    }

    /**
     * 본문 선택. 체인 순서대로 보고 {@code minBodyChars} 이상인 첫 후보를 쓴다.
     * <p>
     * 어느 후보도 임계치에 못 미치면 마지막 후보가 아니라 가장 긴 후보를 남긴다
     * (길이가 같으면 앞쪽). 후보가 하나도 없으면 "".
     */
    String body(Document dom) {
        String best = "";
        for (TextFieldStrategy s : bodyChain) {
            Optional<String> text = s.extract(dom);
            if (text.isEmpty()) continue;
            if (text.get().length() >= minBodyChars) {
                LOG.debug("Body via {} ({} chars)", s.name(), text.get().length());
                return text.get();
            }
            if (text.get().length() > best.length()) best = text.get();
        }
        return best;
    }

    private static Optional<String> first(List<TextFieldStrategy> chain, Document dom) {
        for (TextFieldStrategy s : chain) {
            Optional<String> v = s.extract(dom);
            if (v.isPresent()) return v;
        }
        return Optional.empty();
    }

    static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
