package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

import java.util.List;

/** 결과 페이지에서 기사 링크 후보(절대 URL)를 뽑는 전략. 필터링은 호출자가 한다. */
public interface LinkStrategy {

    /** 로그용 이름 */
    String name();

    /** scope 안에서 문서 순서대로 후보 href(절대 URL) */
    List<String> candidates(Element scope);
}
