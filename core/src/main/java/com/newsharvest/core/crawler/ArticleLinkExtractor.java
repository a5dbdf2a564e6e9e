package com.newsharvest.core.crawler;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 결과 페이지 DOM → 기사 URL 목록(순서 유지).
 * 전략 체인을 순서대로 시도하고, 수락된 결과가 하나라도 나온 첫 전략을 채택한다.
 */
public final class ArticleLinkExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ArticleLinkExtractor.class);

    /** 결과 영역 컨테이너. 있으면 이 안만 본다(메뉴/사이드바 링크 제외). */
    public static final String RESULTS_SCOPE = "div.td-main-content-wrap";

    private final ArticleUrlFilter filter;
    private final List<LinkStrategy> chain;

    public ArticleLinkExtractor(String origin) {
        this(new ArticleUrlFilter(origin), List.of(new TitleHeadingLinkStrategy(), new AnchorScanLinkStrategy()));
    }

    public ArticleLinkExtractor(ArticleUrlFilter filter, List<LinkStrategy> chain) {
        this.filter = Objects.requireNonNull(filter, "filter");
        this.chain = List.copyOf(chain);
        if (this.chain.isEmpty()) throw new IllegalArgumentException("chain must not be empty");
    }

    /**
     * @param dom      결과 페이지 (baseUri 가 설정돼 있으면 상대 href 도 해석됨)
     * @param baseUrl  로그용 페이지 URL
     * @param exclude  이미 발견/예약된 URL (null 허용)
     */
    public List<String> extractLinks(Document dom, String baseUrl, Set<String> exclude) {
        if (dom == null) return List.of();
        Element scope = dom.selectFirst(RESULTS_SCOPE);
        if (scope == null) {
            LOG.debug("Results container not found on {}, scanning whole page", baseUrl);
            scope = dom;
        }

        for (LinkStrategy strategy : chain) {
            Set<String> accepted = new LinkedHashSet<>();
            for (String href : strategy.candidates(scope)) {
                if (filter.accept(href, exclude, accepted)) accepted.add(href);
            }
            if (!accepted.isEmpty()) {
                LOG.debug("{} link(s) via {} on {}", accepted.size(), strategy.name(), baseUrl);
                return new ArrayList<>(accepted);
            }
        }
        return List.of();
    }
}
