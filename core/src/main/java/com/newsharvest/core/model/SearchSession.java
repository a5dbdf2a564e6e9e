package com.newsharvest.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * 검색 1회 호출의 실행 컨텍스트.
 * 세션 id / 카운터 / 프런티어를 전역 상태 대신 명시적으로 들고 다닌다.
 */
public final class SearchSession {

    private final String sessionId;
    private final String keyword;
    private final int maxArticles;
    private final int maxPages;
    private final DedupFrontier frontier;
    private int pagesVisited;
    private int articlesYielded;

    public SearchSession(String keyword, int maxArticles, int maxPages) {
        this(keyword, maxArticles, maxPages, new DedupFrontier());
    }

    public SearchSession(String keyword, int maxArticles, int maxPages, DedupFrontier frontier) {
        if (maxArticles < 1) throw new IllegalArgumentException("maxArticles must be >= 1");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.sessionId = UUID.randomUUID().toString().substring(0, 8);
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.maxArticles = maxArticles;
        this.maxPages = maxPages;
        this.frontier = Objects.requireNonNull(frontier, "frontier");
    }

    public String getSessionId() { return sessionId; }
    public String getKeyword() { return keyword; }
    public int getMaxArticles() { return maxArticles; }
    public int getMaxPages() { return maxPages; }
    public DedupFrontier getFrontier() { return frontier; }
    public int getPagesVisited() { return pagesVisited; }
    public int getArticlesYielded() { return articlesYielded; }

    public void pageVisited() { pagesVisited++; }
    public void articleYielded() { articlesYielded++; }

    public boolean articleBudgetReached() { return frontier.size() >= maxArticles; }
    public boolean pageBudgetReached() { return pagesVisited >= maxPages; }
}
