package com.newsharvest.core.util;

import com.newsharvest.core.model.CrawlConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 요청 간 의무 간격(백오프 아님). [min,max] 구간에서 균등 랜덤으로 뽑아 잠든다.
 * 직전 요청의 성공/실패와 무관하게 적용되며, 세션의 첫 fetch 앞에서만 생략된다.
 */
public final class Pacer {

    private final CrawlConfig.Pacing pacing;
    private final Sleeper sleeper;
    private boolean first = true;

    public Pacer(CrawlConfig.Pacing pacing, Sleeper sleeper) {
        this.pacing = Objects.requireNonNull(pacing, "pacing");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** 새 세션 시작: 다음 fetch 는 대기 없이 나간다 */
    public void reset() { first = true; }

    public Duration beforePageFetch() throws InterruptedException {
        return pause(pacing.getPageDelayMinMs(), pacing.getPageDelayMaxMs());
    }

    public Duration beforeArticleFetch() throws InterruptedException {
        return pause(pacing.getArticleDelayMinMs(), pacing.getArticleDelayMaxMs());
    }

    private Duration pause(long minMs, long maxMs) throws InterruptedException {
        if (first) {
            first = false;
            return Duration.ZERO;
        }
        Duration d = Duration.ofMillis(draw(minMs, maxMs));
        sleeper.sleep(d);
        return d;
    }

    static long draw(long minMs, long maxMs) {
        long lo = Math.max(0, minMs);
        long hi = Math.max(lo, maxMs);
        if (hi == lo) return lo;
        return ThreadLocalRandom.current().nextLong(lo, hi + 1);
    }
}
