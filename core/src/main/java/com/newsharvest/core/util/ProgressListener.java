package com.newsharvest.core.util;

/**
 * 크롤 진행 콜백. 단계는 SEARCH(검색/홈 페이지 탐색) → EXTRACT(기사별) → DONE 순.
 * total 을 모르는 단계에서는 -1.
 */
@FunctionalInterface
public interface ProgressListener {

    enum Phase { SEARCH, EXTRACT, DONE }

    void onProgress(Phase phase, int done, int total);

    /** 0.0~1.0, total 을 모르면 0.0 */
    static double fraction(int done, int total) {
        if (total <= 0) return 0.0;
        return Math.min(1.0, Math.max(0.0, (double) done / total));
    }

    ProgressListener NONE = (phase, done, total) -> {};
}
