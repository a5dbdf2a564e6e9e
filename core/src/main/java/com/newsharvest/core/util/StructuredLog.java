package com.newsharvest.core.util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트를 JSON 한 줄로 남기는 로거(JUL 위).
 * 이벤트 이름과 레벨은 {@link Event} 에 고정돼 있고, 호출자는 키/값 쌍만 붙인다.
 * {@link #forSession(String)} 으로 묶으면 모든 줄에 session 필드가 들어간다.
 */
public final class StructuredLog {

    /** 크롤 파이프라인이 내보내는 이벤트 */
    public enum Event {
        CRAWL_START("crawl-start", Level.INFO),
        CRAWL_DONE("crawl-done", Level.INFO),
        SEARCH_PAGE("search-page", Level.INFO),
        FETCH_FAILED("fetch-failed", Level.WARNING),
        FETCH_THREW("fetch-threw", Level.SEVERE),
        CHALLENGE_MARKERS("challenge-markers", Level.WARNING),
        ARTICLE_EXTRACTED("article-extracted", Level.INFO),
        ARTICLE_BAD_URL("article-bad-url", Level.SEVERE),
        ARTICLE_FAILED("article-extract-failed", Level.SEVERE),
        EXPORT_DONE("export-done", Level.INFO);

        private final String wireName;
        private final Level level;

        Event(String wireName, Level level) {
            this.wireName = wireName;
            this.level = level;
        }

        public String wireName() { return wireName; }
        public Level level() { return level; }
    }

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Logger jul;
    private final String comp;
    private final String session;

    private StructuredLog(Logger jul, String comp, String session) {
        this.jul = jul;
        this.comp = comp;
        this.session = session;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), null);
    }

    /** 같은 로거, session 필드 고정 */
    public StructuredLog forSession(String sessionId) {
        return new StructuredLog(jul, comp, sessionId);
    }

    public void emit(Event event, Object... kvs) {
        emit(event, null, kvs);
    }

    public void emit(Event event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(event.level())) return;
        String line = line(event, comp, session, t, kvs);
        if (t == null) jul.log(event.level(), line); else jul.log(event.level(), line, t);
    }

    /** 한 줄 JSON 조립 (포맷 확인용으로 패키지 공개) */
    static String line(Event event, String comp, String session, Throwable t, Object... kvs) {
        ObjectNode node = NODES.objectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", event.level().getName());
        node.put("comp", comp);
        node.put("event", event.wireName());
        if (session != null) node.put("session", session);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(node, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", t.getMessage());
        }
        return node.toString();
    }

    private static void put(ObjectNode node, String key, Object v) {
        if (v == null) node.putNull(key);
        else if (v instanceof Integer n) node.put(key, n);
        else if (v instanceof Long n) node.put(key, n);
        else if (v instanceof Double n) node.put(key, n);
        else if (v instanceof Boolean b) node.put(key, b);
        else node.put(key, String.valueOf(v));
    }
}
