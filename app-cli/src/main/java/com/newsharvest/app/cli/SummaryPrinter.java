package com.newsharvest.app.cli;

import com.newsharvest.core.model.ArticleRecord;
import com.newsharvest.core.model.CrawlReport;
import com.newsharvest.core.model.SearchHit;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/** 실행 끝에 찍는 사람용 요약 */
final class SummaryPrinter {

    private final PrintWriter out;

    SummaryPrinter(PrintWriter out) {
        this.out = out;
    }

    void printFiles(List<Path> files, boolean separate) {
        if (!separate) {
            files.forEach(f -> out.println("Results saved to: " + f));
            return;
        }
        out.println("Saved " + files.size() + " individual article files");
        files.stream().limit(5).forEach(f -> out.println("  - " + f.getFileName()));
        if (files.size() > 5) out.println("  ... and " + (files.size() - 5) + " more files");
    }

    void printReport(CrawlReport report) {
        out.println();
        out.println("=".repeat(40));
        out.println("SUMMARY: " + report.succeeded() + "/" + report.attempted() + " articles scraped");
        if (report.stats().challengePages() > 0) {
            out.println("Warning: " + report.stats().challengePages() + " page(s) looked like a bot challenge");
        }

        List<ArticleRecord> records = report.records();
        for (int i = 0; i < records.size(); i++) {
            ArticleRecord r = records.get(i);
            out.println();
            if (!r.isSuccess()) {
                out.println((i + 1) + ". FAILED: " + r.getError());
                continue;
            }
            out.println((i + 1) + ". " + abbreviate(r.getTitle(), 60) + searchInfo(r.getSearchHit()));
            out.println("   Author: " + r.getAuthor());
            out.println("   Date: " + r.getPublishDateRaw());
            out.println("   Content: " + r.getBodyLength() + " chars");
            out.println("   Images: " + r.getImages().size());
            out.println("   Comments: " + r.getRealCommentCount());
        }
        out.flush();
    }

    static String searchInfo(SearchHit hit) {
        if (hit == null) return "";
        return " (Rank #" + hit.rank() + "/" + hit.totalResults() + ", " + hit.pagesSearched() + " pages)";
    }

    static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
