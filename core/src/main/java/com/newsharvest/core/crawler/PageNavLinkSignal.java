package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

/** 페이지 내비 블록 안의 N+1 페이지 링크 */
public final class PageNavLinkSignal implements NextPageSignal {

    @Override public String name() { return "page-nav-link"; }

    @Override
    public boolean hasNext(PageContext ctx) {
        String next = ctx.nextPagePath();
        for (Element a : ctx.dom().select("div.page-nav a[href]")) {
            if (LinkHrefs.absHref(a).contains(next)) return true;
        }
        return false;
    }
}
