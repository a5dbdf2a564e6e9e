package com.newsharvest.core.crawler;

import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 기사 URL 수락 조건.
 * - 사이트 정규 origin 으로 시작
 * - 연도 세그먼트 /20xx/ 포함
 * - 페이지네이션(/page/) 아님
 * - 댓글 앵커(#comments, #respond) 아님
 * - 제외 집합 / 이미 수락한 목록에 없음
 */
public final class ArticleUrlFilter {

    private static final Pattern YEAR_SEGMENT = Pattern.compile("/20\\d{2}/");

    private final String origin;

    public ArticleUrlFilter(String origin) {
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public String origin() { return origin; }

    public boolean accept(String href, Collection<String> exclude, Collection<String> acceptedSoFar) {
        if (!looksLikeArticle(href)) return false;
        if (exclude != null && exclude.contains(href)) return false;
        return acceptedSoFar == null || !acceptedSoFar.contains(href);
    }

    /** 집합과 무관한 형태 검사만 */
    public boolean looksLikeArticle(String href) {
        if (href == null || href.isBlank()) return false;
        if (!href.startsWith(origin)) return false;
        if (!YEAR_SEGMENT.matcher(href).find()) return false;
        if (href.contains("/page/")) return false;
        return !href.contains("#comments") && !href.contains("#respond");
    }
}
