package com.newsharvest.core.api;

import java.util.List;

public interface ISearchCrawler {
    /** 키워드 검색 결과를 페이지 단위로 훑어 기사 URL(발견 순서, 중복 없음)을 모은다. */
    List<String> crawl(String keyword, int maxArticles, int maxPages);
}
