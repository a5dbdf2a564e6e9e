package com.newsharvest.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsharvest.core.model.ArticleRecord;
import com.newsharvest.core.model.CrawlReport;
import com.newsharvest.core.model.CrawlRequest;
import com.newsharvest.core.util.StructuredLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Exporter.
 * - 기본: 전체 결과를 배열 하나로 results_{operation}_{ts}.json
 * - separateFiles: 성공한 기사만 기사별 파일 {Slug}_{yyyyMMdd}_{###}.json (###은 결과 내 순번)
 */
public class JsonArticleExporter implements ArticleExporter {

    private static final StructuredLog SLOG = StructuredLog.get(JsonArticleExporter.class);

    private final ObjectWriter writer;
    private final boolean separateFiles;

    public JsonArticleExporter(boolean separateFiles) {
        ObjectMapper om = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.writer = om.writerWithDefaultPrettyPrinter();
        this.separateFiles = separateFiles;
    }

    @Override
    public List<Path> export(Path baseDir, CrawlRequest request, CrawlReport report, Instant startedAt) throws IOException {
        Path dir = (baseDir == null) ? Path.of(".") : baseDir;
        Files.createDirectories(dir);
        Instant ts = (startedAt == null) ? Instant.now() : startedAt;

        List<Path> written = new ArrayList<>();
        if (separateFiles) {
            List<ArticleRecord> records = report.records();
            for (int i = 0; i < records.size(); i++) {
                ArticleRecord r = records.get(i);
                if (!r.isSuccess()) continue;
                Path file = ArticleFileNaming.articlePath(dir, r.getTitle(), r.getPublishDateRaw(), i + 1, ts);
                writer.writeValue(file.toFile(), r);
                written.add(file);
            }
        } else {
            Path file = ArticleFileNaming.combinedPath(dir, request, ts);
            writer.writeValue(file.toFile(), report.records());
            written.add(file);
        }
        SLOG.emit(StructuredLog.Event.EXPORT_DONE, "dir", dir.toString(), "files", written.size(), "separate", separateFiles);
        return written;
    }
}
