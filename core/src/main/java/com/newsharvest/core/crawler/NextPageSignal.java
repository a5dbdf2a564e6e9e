package com.newsharvest.core.crawler;

/**
 * "다음 페이지가 있는가?" 의 단일 근거.
 * 각 신호는 힌트일 뿐이며 컨트롤러가 OR 로 합친다.
 */
public interface NextPageSignal {
    String name();
    boolean hasNext(PageContext ctx);
}
