package com.newsharvest.core.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 페이지 fetch 재시도 규칙(전송 계층 한정, 크롤 간격과는 별개).
 * 대상: 429 / 5xx / 전송 실패(-1). 그 외 응답은 바로 포기한다.
 * 지연 = baseDelay * 2^(attempt-1) ± jitter, 서버의 Retry-After(초)가 더 길면 그 값(상한 retryAfterCap).
 *
 * @param maxAttempts   첫 시도 포함 최대 시도 수
 * @param jitter        0.0~1.0 (0.1 이면 ±10%)
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double jitter, Duration retryAfterCap) {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    /** 재시도 없음 */
    public static final RetryPolicy NEVER = new RetryPolicy(1, Duration.ZERO, 0.0, Duration.ZERO);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitter must be in [0,1]");
        if (retryAfterCap == null || retryAfterCap.isNegative())
            throw new IllegalArgumentException("retryAfterCap must be >= 0");
    }

    /** 1s → 2s (±10%), 최대 3회, Retry-After 상한 30초 */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 0.1, Duration.ofSeconds(30));
    }

    public static boolean retryable(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == -1;
    }

    /**
     * attempt 번째 시도가 statusCode 로 끝났을 때 다음 시도 전 대기.
     * 재시도하지 않으면 empty.
     */
    public Optional<Duration> delayAfter(int attempt, int statusCode, String retryAfter) {
        if (attempt >= maxAttempts || !retryable(statusCode)) return Optional.empty();
        Duration delay = backoff(attempt);
        Duration hinted = parseRetryAfter(retryAfter, retryAfterCap);
        if (hinted != null && hinted.compareTo(delay) > 0) delay = hinted;
        return Optional.of(delay);
    }

    Duration backoff(int attempt) {
        long raw = baseDelay.toMillis() * (1L << Math.max(0, attempt - 1));
        if (jitter == 0.0 || raw == 0) return Duration.ofMillis(raw);
        double factor = 1.0 - jitter + ThreadLocalRandom.current().nextDouble(2 * jitter);
        return Duration.ofMillis((long) (raw * factor));
    }

    /** 초 단위 Retry-After 만 해석(HTTP-date 형식은 무시). */
    static Duration parseRetryAfter(String value, Duration cap) {
        if (value == null || value.isBlank()) return null;
        try {
            long sec = Long.parseLong(value.trim());
            if (sec < 0) return null;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(cap) > 0 ? cap : d;
        } catch (NumberFormatException e) {
            LOG.debug("Unsupported Retry-After value: {}", value);
            return null;
        }
    }
}
