package com.newsharvest.core.model;

/** 키워드 검색으로 수집된 기사의 검색 메타(순위/전체 결과 수/검색한 페이지 수). */
public record SearchHit(String keyword, int rank, int totalResults, int pagesSearched) {}
