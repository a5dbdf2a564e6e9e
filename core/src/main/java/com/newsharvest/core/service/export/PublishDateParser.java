package com.newsharvest.core.service.export;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** 사이트가 쓰는 날짜 표기 → LocalDate. 순서대로 시도, 첫 성공. */
public final class PublishDateParser {
    private PublishDateParser() {}

    static final List<DateTimeFormatter> FORMATS = List.of(
            fmt("MMMM d, yyyy"),   // March 20, 2025
            fmt("MMM d, yyyy"),    // Mar 20, 2025
            fmt("yyyy-MM-dd"),
            fmt("M/d/yyyy"),       // 03/20/2025
            fmt("d/M/yyyy"),       // 20/03/2025
            fmt("MMMM d yyyy"),
            fmt("MMM d yyyy"));

    private static DateTimeFormatter fmt(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    }

    public static Optional<LocalDate> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        if (s.isEmpty() || s.equalsIgnoreCase("unknown") || s.equalsIgnoreCase("n/a")) return Optional.empty();
        for (DateTimeFormatter f : FORMATS) {
            try {
                return Optional.of(LocalDate.parse(s, f));
            } catch (DateTimeParseException ignore) {
                // 다음 형식
            }
        }
        return Optional.empty();
    }
}
