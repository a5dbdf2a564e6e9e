package com.newsharvest.core.crawler;

import org.jsoup.nodes.Document;

/**
 * 다음 페이지 판단에 필요한 현재 페이지 상태.
 *
 * @param dom         현재 결과 페이지
 * @param pageNum     현재 페이지 번호(1부터)
 * @param newResults  이번 페이지에서 새로 수락된 URL 수
 * @param maxPages    페이지 상한
 */
public record PageContext(Document dom, int pageNum, int newResults, int maxPages) {

    /** 다음 페이지 경로 조각: /page/N+1/ */
    public String nextPagePath() {
        return "/page/" + (pageNum + 1) + "/";
    }
}
