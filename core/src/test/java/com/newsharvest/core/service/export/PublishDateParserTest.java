package com.newsharvest.core.service.export;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class PublishDateParserTest {

    private static final LocalDate MARCH_20 = LocalDate.of(2025, 3, 20);

    @Test
    void site_formats_are_recognised() {
        assertThat(PublishDateParser.parse("March 20, 2025")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("Mar 20, 2025")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("2025-03-20")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("03/20/2025")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("3/20/2025")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("March 20 2025")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("  Mar 20 2025 ")).contains(MARCH_20);
    }

    @Test
    void day_first_only_when_month_first_is_impossible() {
        assertThat(PublishDateParser.parse("20/03/2025")).contains(MARCH_20);
        assertThat(PublishDateParser.parse("04/03/2025")).contains(LocalDate.of(2025, 4, 3));
    }

    @Test
    void sentinels_and_garbage_are_empty() {
        assertThat(PublishDateParser.parse(null)).isEmpty();
        assertThat(PublishDateParser.parse("Unknown")).isEmpty();
        assertThat(PublishDateParser.parse("N/A")).isEmpty();
        assertThat(PublishDateParser.parse("2 hours ago")).isEmpty();
    }
}
