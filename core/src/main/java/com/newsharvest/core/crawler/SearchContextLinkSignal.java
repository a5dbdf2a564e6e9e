package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

/** 페이지 어디서든 검색 쿼리(?s=)가 붙은 N+1 페이지 링크 */
public final class SearchContextLinkSignal implements NextPageSignal {

    @Override public String name() { return "search-context-link"; }

    @Override
    public boolean hasNext(PageContext ctx) {
        String next = ctx.nextPagePath();
        for (Element a : ctx.dom().select("a[href]")) {
            String href = LinkHrefs.absHref(a);
            if (href.contains(next) && href.contains("?s=")) return true;
        }
        return false;
    }
}
