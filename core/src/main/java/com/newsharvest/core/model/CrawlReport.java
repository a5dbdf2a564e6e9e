package com.newsharvest.core.model;

import java.util.List;

/**
 * 세션 결과: 발견 순서대로의 기사 레코드 + 집계.
 * 시도 0건(attempted=0)과 성공 0건(succeeded=0, attempted>0)을 구분할 수 있다.
 */
public record CrawlReport(Operation operation,
                          List<ArticleRecord> records,
                          int pagesVisited,
                          int urlsDiscovered,
                          CrawlStats.Snapshot stats) {

    public CrawlReport {
        records = (records == null) ? List.of() : List.copyOf(records);
    }

    public int attempted() { return records.size(); }

    public int succeeded() {
        return (int) records.stream().filter(ArticleRecord::isSuccess).count();
    }

    /** METADATA 센티널을 뺀 실제 댓글 총합 */
    public int realComments() {
        return records.stream().mapToInt(ArticleRecord::getRealCommentCount).sum();
    }

    public int images() {
        return records.stream().mapToInt(r -> r.getImages().size()).sum();
    }
}
