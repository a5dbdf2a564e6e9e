package com.newsharvest.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 값 검증은 validate() 에서 한 번에 한다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_ORIGIN = "https://www.nrinow.news/";

    /** 요청 간 사람 같은 간격: YAML `pacing:` 섹션과 매핑 */
    public static final class Pacing {
        private long pageDelayMinMs = 2_000;
        private long pageDelayMaxMs = 4_000;
        private long articleDelayMinMs = 3_000;
        private long articleDelayMaxMs = 7_000;

        public long getPageDelayMinMs() { return pageDelayMinMs; }
        public Pacing setPageDelayMinMs(long v) { this.pageDelayMinMs = v; return this; }

        public long getPageDelayMaxMs() { return pageDelayMaxMs; }
        public Pacing setPageDelayMaxMs(long v) { this.pageDelayMaxMs = v; return this; }

        public long getArticleDelayMinMs() { return articleDelayMinMs; }
        public Pacing setArticleDelayMinMs(long v) { this.articleDelayMinMs = v; return this; }

        public long getArticleDelayMaxMs() { return articleDelayMaxMs; }
        public Pacing setArticleDelayMaxMs(long v) { this.articleDelayMaxMs = v; return this; }

        /** 테스트용: 모든 지연 0 */
        public static Pacing none() {
            return new Pacing().setPageDelayMinMs(0).setPageDelayMaxMs(0)
                    .setArticleDelayMinMs(0).setArticleDelayMaxMs(0);
        }
    }

    // ---------- 기본 필드 ----------
    private String siteOrigin = DEFAULT_ORIGIN;   // 정규 origin (끝 슬래시 포함)
    private Duration timeout = Duration.ofSeconds(15);
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    private boolean followRedirects = true;

    // ---------- search ----------
    private int maxArticles = 10;
    private int maxPages = 15;
    private int nominalPerPage = 7;               // 사이트 템플릿 기준 페이지당 결과 수

    // ---------- output ----------
    private Path outputDir = Path.of(".");
    private boolean separateFiles = false;

    private Pacing pacing = new Pacing();

    // ---------- getters ----------
    public String getSiteOrigin() { return siteOrigin; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getMaxArticles() { return maxArticles; }
    public int getMaxPages() { return maxPages; }
    public int getNominalPerPage() { return nominalPerPage; }
    public Path getOutputDir() { return outputDir; }
    public boolean isSeparateFiles() { return separateFiles; }
    public Pacing getPacing() { return pacing; }

    // ---------- fluent setters ----------
    public CrawlConfig setSiteOrigin(String origin) {
        if (origin != null && !origin.isBlank()) {
            String o = origin.trim();
            this.siteOrigin = o.endsWith("/") ? o : o + "/";
        }
        return this;
    }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setMaxArticles(int maxArticles) { this.maxArticles = maxArticles; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setNominalPerPage(int nominalPerPage) { this.nominalPerPage = nominalPerPage; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setSeparateFiles(boolean v) { this.separateFiles = v; return this; }
    public CrawlConfig setPacing(Pacing pacing) { this.pacing = (pacing != null ? pacing : new Pacing()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(siteOrigin, "siteOrigin");
        if (!siteOrigin.startsWith("http://") && !siteOrigin.startsWith("https://"))
            throw new IllegalArgumentException("siteOrigin must be http(s): " + siteOrigin);
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxArticles < 1) throw new IllegalArgumentException("maxArticles must be >= 1");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (nominalPerPage < 1) throw new IllegalArgumentException("nominalPerPage must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");

        Objects.requireNonNull(pacing, "pacing");
        checkWindow("pacing.pageDelay", pacing.getPageDelayMinMs(), pacing.getPageDelayMaxMs());
        checkWindow("pacing.articleDelay", pacing.getArticleDelayMinMs(), pacing.getArticleDelayMaxMs());
    }

    private static void checkWindow(String name, long min, long max) {
        if (min < 0) throw new IllegalArgumentException(name + "MinMs must be >= 0");
        if (max < min) throw new IllegalArgumentException(name + "MaxMs must be >= " + name + "MinMs");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public int getTimeoutMsInt() {
        long ms = timeout.toMillis();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
