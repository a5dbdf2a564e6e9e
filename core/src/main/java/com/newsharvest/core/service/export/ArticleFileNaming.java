package com.newsharvest.core.service.export;

import com.newsharvest.core.model.CrawlRequest;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class ArticleFileNaming {
    private ArticleFileNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());
    public static final DateTimeFormatter DATE_FMT = DateTimeFormatter.BASIC_ISO_DATE; // yyyyMMdd

    private static final Set<String> SKIP_WORDS = Set.of("the", "and", "for", "with", "from");
    private static final int MAX_SLUG = 30;

    /** results_{operation}_{yyyyMMdd_HHmmss}.json */
    public static Path combinedPath(Path dir, CrawlRequest request, Instant startedAt) {
        return dir.resolve("results_" + operationLabel(request) + "_" + TS_FMT.format(startedAt) + ".json");
    }

    /** {Slug}_{yyyyMMdd}_{###}.json, 날짜는 게시일 파싱 실패 시 실행일 */
    public static Path articlePath(Path dir, String title, String publishDateRaw, int index, Instant startedAt) {
        LocalDate date = PublishDateParser.parse(publishDateRaw)
                .orElseGet(() -> LocalDate.ofInstant(startedAt, ZoneId.systemDefault()));
        return dir.resolve(String.format(Locale.ROOT, "%s_%s_%03d.json", slug(title), DATE_FMT.format(date), index));
    }

    /** 키워드 검색은 search_{키워드}, 나머지는 동작 라벨 */
    public static String operationLabel(CrawlRequest request) {
        return switch (request.operation()) {
            case KEYWORD -> "search_" + request.keyword().trim().replaceAll("\\s+", "_").replaceAll("[^A-Za-z0-9_-]", "");
            default -> request.operation().label();
        };
    }

    /** 제목 앞 6단어 중 의미 있는 단어 3개(영숫자만, 3자 이상, 불용어 제외)를 _ 로 연결, 30자 제한 */
    public static String slug(String title) {
        if (title == null) return "article";
        String[] words = title.trim().split("\\s+");
        List<String> picked = new ArrayList<>(3);
        for (int i = 0; i < words.length && i < 6; i++) {
            String clean = words[i].replaceAll("[^\\p{Alnum}]", "");
            if (clean.length() > 2 && !SKIP_WORDS.contains(clean.toLowerCase(Locale.ROOT))) picked.add(clean);
            if (picked.size() >= 3) break;
        }
        String s = String.join("_", picked);
        if (s.length() > MAX_SLUG) s = s.substring(0, MAX_SLUG);
        return s.isEmpty() ? "article" : s;
    }
}
