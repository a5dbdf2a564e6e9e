package com.newsharvest.core.util;

import com.newsharvest.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * siteOrigin: "https://www.nrinow.news/"
 * timeoutMs: 15000
 * userAgent: "Mozilla/5.0 ..."
 * followRedirects: true
 * search:
 *   maxArticles: 10
 *   maxPages: 15
 *   nominalPerPage: 7
 * pacing:
 *   pageDelayMinMs: 2000
 *   pageDelayMaxMs: 4000
 *   articleDelayMinMs: 3000
 *   articleDelayMaxMs: 7000
 * output:
 *   dir: "out"
 *   separateFiles: false
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 crawl.yml, 없으면 클래스패스 기본값 */
    public static CrawlConfig loadDefault() throws IOException {
        Path local = Path.of("crawl.yml");
        if (Files.exists(local)) return load(local);
        try (InputStream in = YamlConfigLoader.class.getResourceAsStream("/crawl.yml")) {
            if (in == null) return CrawlConfig.defaults();
            return load(in);
        }
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스 등 스트림에서 읽기 */
    public static CrawlConfig load(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "siteOrigin", cfg::setSiteOrigin);
        setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);

        // 2) search.*
        Map<String, Object> search = getMap(map, "search");
        if (search != null) {
            setInt(search, "maxArticles", cfg::setMaxArticles);
            setInt(search, "maxPages", cfg::setMaxPages);
            setInt(search, "nominalPerPage", cfg::setNominalPerPage);
        }

        // 3) pacing.*
        Map<String, Object> pacing = getMap(map, "pacing");
        if (pacing != null) {
            var p = cfg.getPacing();
            setLong(pacing, "pageDelayMinMs", p::setPageDelayMinMs);
            setLong(pacing, "pageDelayMaxMs", p::setPageDelayMaxMs);
            setLong(pacing, "articleDelayMinMs", p::setArticleDelayMinMs);
            setLong(pacing, "articleDelayMaxMs", p::setArticleDelayMaxMs);
        }

        // 4) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setBoolean(output, "separateFiles", cfg::setSeparateFiles);
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }
}
