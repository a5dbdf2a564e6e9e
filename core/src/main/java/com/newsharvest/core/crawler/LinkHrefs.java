package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

final class LinkHrefs {
    private LinkHrefs() {}

    /** abs:href 우선(문서 base 가 있을 때), 없으면 원문 href */
    static String absHref(Element a) {
        String abs = a.attr("abs:href");
        if (abs != null && !abs.isBlank()) return abs.trim();
        return a.attr("href").trim();
    }
}
