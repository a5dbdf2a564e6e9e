package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 폴백: scope 안의 모든 a[href]. 정밀도 대신 재현율. */
public final class AnchorScanLinkStrategy implements LinkStrategy {

    @Override public String name() { return "anchor-scan"; }

    @Override
    public List<String> candidates(Element scope) {
        List<String> out = new ArrayList<>();
        for (Element a : scope.select("a[href]")) {
            out.add(LinkHrefs.absHref(a));
        }
        return out;
    }
}
