package com.newsharvest.core.http;

import com.newsharvest.core.api.IPageFetcher;
import com.newsharvest.core.model.CrawlConfig;
import com.newsharvest.core.model.FetchedPage;
import com.newsharvest.core.util.Sleeper;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 기본 JSoup 기반 fetcher: 정적 HTML GET.
 * JS 렌더링은 하지 않는다. 브라우저 기반 구현은 IPageFetcher 로 바꿔 끼운다.
 * 429/5xx/전송 실패는 RetryPolicy 에 따라 이 계층 안에서만 재시도.
 */
public class JsoupPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupPageFetcher.class);

    /** 테스트/모킹용 송신 훅: (url) → 상태 코드 + 본문 */
    @FunctionalInterface
    public interface HttpSender {
        RawResponse send(URI url) throws IOException;
    }

    /** retryAfter: Retry-After 헤더 원문(없으면 null) */
    public record RawResponse(int statusCode, String body, String retryAfter) {
        public RawResponse(int statusCode, String body) { this(statusCode, body, null); }
    }

    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public JsoupPageFetcher(CrawlConfig config) {
        this(config, RetryPolicy.defaults(), Sleeper.THREAD);
    }

    public JsoupPageFetcher(CrawlConfig config, RetryPolicy retryPolicy, Sleeper sleeper) {
        this(defaultSender(Objects.requireNonNull(config, "config")), retryPolicy, sleeper);
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public JsoupPageFetcher(HttpSender sender, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryPolicy = (retryPolicy != null) ? retryPolicy : RetryPolicy.NEVER;
        this.sleeper = (sleeper != null) ? sleeper : Sleeper.NONE;
    }

    private static HttpSender defaultSender(CrawlConfig cfg) {
        return url -> {
            Connection.Response rsp = Jsoup.connect(url.toString())
                    .userAgent(cfg.getUserAgent())
                    .timeout(cfg.getTimeoutMsInt())
                    .followRedirects(cfg.isFollowRedirects())
                    .ignoreHttpErrors(true)   // 상태 코드는 직접 판정
                    .header("Accept", "text/html,application/xhtml+xml")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .execute();
            return new RawResponse(rsp.statusCode(), rsp.body(), rsp.header("Retry-After"));
        };
    }

    @Override
    public Optional<FetchedPage> fetch(URI url) {
        if (url == null) return Optional.empty();
        int attempt = 1;
        while (true) {
            int status;
            String body = null;
            String retryAfter = null;
            try {
                RawResponse rsp = sender.send(url);
                status = rsp.statusCode();
                retryAfter = rsp.retryAfter();
                if (status >= 200 && status < 300) body = (rsp.body() == null ? "" : rsp.body());
            } catch (IOException e) {
                LOG.debug("Fetch error on {} (attempt {}): {}", url, attempt, e.toString());
                status = -1;
            }

            if (body != null) {
                return Optional.of(new FetchedPage(url, body, Instant.now()));
            }
            Optional<Duration> delay = retryPolicy.delayAfter(attempt, status, retryAfter);
            if (delay.isEmpty()) {
                LOG.warn("Fetch failed: {} (status={}, attempts={})", url, status, attempt);
                return Optional.empty();
            }
            LOG.debug("Retrying {} in {} ms (status={}, attempt={})", url, delay.get().toMillis(), status, attempt);
            try {
                sleeper.sleep(delay.get());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            attempt++;
        }
    }
}
