package com.newsharvest.core.crawler;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 검색 결과 페이지 URL.
 * 1페이지: {origin}?s=kw, N페이지: {origin}page/N/?s=kw
 */
public final class SearchUrlBuilder {

    private final String origin;

    public SearchUrlBuilder(String origin) {
        Objects.requireNonNull(origin, "origin");
        this.origin = origin.endsWith("/") ? origin : origin + "/";
    }

    public URI page(String keyword, int pageNum) {
        if (pageNum < 1) throw new IllegalArgumentException("pageNum must be >= 1");
        String q = "?s=" + URLEncoder.encode(keyword == null ? "" : keyword.trim(), StandardCharsets.UTF_8);
        return URI.create(pageNum == 1 ? origin + q : origin + "page/" + pageNum + "/" + q);
    }
}
