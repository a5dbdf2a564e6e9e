package com.newsharvest.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/** 한 번의 fetch 결과(렌더링된 HTML). 생성 후 불변. */
public record FetchedPage(URI url, String html, Instant fetchedAt) {

    public FetchedPage {
        Objects.requireNonNull(url, "url");
        html = (html == null) ? "" : html;
        fetchedAt = (fetchedAt == null) ? Instant.now() : fetchedAt;
    }

    public static FetchedPage of(URI url, String html) {
        return new FetchedPage(url, html, Instant.now());
    }
}
