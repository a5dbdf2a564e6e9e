package com.newsharvest.core.model;

/**
 * 호출 표면(동작 선택 + 상한). 모순된 조합은 호출자 입력 오류로 거절한다.
 */
public record CrawlRequest(Operation operation, String keyword, String url, int maxArticles, int maxPages) {

    public static CrawlRequest latest(int maxArticles) {
        return new CrawlRequest(Operation.LATEST, null, null, maxArticles, 1);
    }

    public static CrawlRequest keyword(String keyword, int maxArticles, int maxPages) {
        return new CrawlRequest(Operation.KEYWORD, keyword, null, maxArticles, maxPages);
    }

    public static CrawlRequest singleUrl(String url) {
        return new CrawlRequest(Operation.SINGLE_URL, null, url, 1, 1);
    }

    /**
     * 인자 조합으로 동작을 고른다. url 과 keyword 를 함께 주면 거절.
     */
    public static CrawlRequest resolve(String keyword, String url, int maxArticles, int maxPages) {
        boolean hasKw = keyword != null && !keyword.isBlank();
        boolean hasUrl = url != null && !url.isBlank();
        if (hasKw && hasUrl) {
            throw new IllegalArgumentException("Cannot use both url and search keyword; pick one operation");
        }
        if (hasUrl) return singleUrl(url.trim());
        if (hasKw) return keyword(keyword.trim(), maxArticles, maxPages);
        return latest(maxArticles);
    }

    /** siteOrigin: 단일 URL 동작은 해당 사이트 URL만 허용 */
    public CrawlRequest validate(String siteOrigin) {
        if (operation == null) throw new IllegalArgumentException("operation is required");
        if (maxArticles < 1) throw new IllegalArgumentException("maxArticles must be >= 1");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        switch (operation) {
            case KEYWORD -> {
                if (keyword == null || keyword.isBlank())
                    throw new IllegalArgumentException("keyword is required for search");
                if (url != null) throw new IllegalArgumentException("url is not allowed for search");
            }
            case SINGLE_URL -> {
                if (url == null || url.isBlank())
                    throw new IllegalArgumentException("url is required for single-url fetch");
                if (keyword != null) throw new IllegalArgumentException("keyword is not allowed for single-url fetch");
                if (siteOrigin != null && !url.startsWith(siteOrigin))
                    throw new IllegalArgumentException("URL must be from " + siteOrigin + " (provided: " + url + ")");
            }
            case LATEST -> {
                if (keyword != null || url != null)
                    throw new IllegalArgumentException("latest crawl takes no keyword/url");
            }
        }
        return this;
    }
}
