package com.newsharvest.app.cli;

import com.newsharvest.core.model.SearchHit;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryPrinterTest {

    @Test
    void search_info_and_abbreviation() {
        assertThat(SummaryPrinter.searchInfo(null)).isEmpty();
        assertThat(SummaryPrinter.searchInfo(new SearchHit("budget", 2, 9, 3))).isEqualTo(" (Rank #2/9, 3 pages)");
        assertThat(SummaryPrinter.abbreviate("short", 60)).isEqualTo("short");
        assertThat(SummaryPrinter.abbreviate("x".repeat(70), 60)).hasSize(63).endsWith("...");
    }

    @Test
    void separate_file_listing_shows_first_five() {
        StringWriter sw = new StringWriter();
        List<Path> files = IntStream.rangeClosed(1, 7).mapToObj(i -> Path.of("out", "a_" + i + ".json")).toList();

        new SummaryPrinter(new PrintWriter(sw, true)).printFiles(files, true);

        assertThat(sw.toString())
                .contains("Saved 7 individual article files")
                .contains("a_5.json")
                .doesNotContain("a_6.json")
                .contains("... and 2 more files");
    }
}
