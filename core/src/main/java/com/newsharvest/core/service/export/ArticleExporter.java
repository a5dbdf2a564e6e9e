package com.newsharvest.core.service.export;

import com.newsharvest.core.model.CrawlReport;
import com.newsharvest.core.model.CrawlRequest;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 크롤 결과를 파일로 내보내는 책임 (JSON 외 형식은 구현 추가) */
public interface ArticleExporter {
    /**
     * @param baseDir   출력 디렉터리 (없으면 생성, null이면 ".")
     * @param request   실행한 요청(파일 이름의 동작 라벨)
     * @param report    세션 결과
     * @param startedAt 실행 시작 시각(파일 타임스탬프/날짜 폴백)
     * @return 생성된 파일 경로들
     */
    List<Path> export(Path baseDir, CrawlRequest request, CrawlReport report, Instant startedAt) throws IOException;
}
