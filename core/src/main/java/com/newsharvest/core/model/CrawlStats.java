package com.newsharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;

/** 크롤 런타임 카운터 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicInteger pagesFetched       = new AtomicInteger(0); // 검색/홈 페이지 fetch 성공
    private final AtomicInteger fetchFailures      = new AtomicInteger(0); // 페이지·기사 fetch 실패 합
    private final AtomicInteger challengePages     = new AtomicInteger(0); // 안티봇 마커가 보인 응답
    private final AtomicInteger articlesAttempted  = new AtomicInteger(0);
    private final AtomicInteger articlesSucceeded  = new AtomicInteger(0);
    private final AtomicInteger extractionFailures = new AtomicInteger(0); // 파싱 중 예외

    public void pageFetched()       { pagesFetched.incrementAndGet(); }
    public void fetchFailed()       { fetchFailures.incrementAndGet(); }
    public void challengeSeen()     { challengePages.incrementAndGet(); }
    public void articleAttempted()  { articlesAttempted.incrementAndGet(); }
    public void articleSucceeded()  { articlesSucceeded.incrementAndGet(); }
    public void extractionFailed()  { extractionFailures.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(pagesFetched.get(), fetchFailures.get(), challengePages.get(),
                articlesAttempted.get(), articlesSucceeded.get(), extractionFailures.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(int pagesFetched, int fetchFailures, int challengePages,
                           int articlesAttempted, int articlesSucceeded, int extractionFailures) {}
}
