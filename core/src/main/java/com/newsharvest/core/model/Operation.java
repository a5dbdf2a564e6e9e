package com.newsharvest.core.model;

/** 호출 가능한 크롤 동작 */
public enum Operation {
    /** 홈페이지 최신 기사 */
    LATEST("latest"),
    /** 키워드 검색 결과 */
    KEYWORD("search"),
    /** 단일 기사 URL */
    SINGLE_URL("single_url");

    private final String label;

    Operation(String label) { this.label = label; }

    /** 출력 파일명 등에 쓰는 짧은 이름 */
    public String label() { return label; }
}
