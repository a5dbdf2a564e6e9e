package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 기사 제목 컨테이너(예: {@code <h3 class="entry-title td-module-title">}) 의 첫 번째 링크.
 * 템플릿 의존적이지만 가장 정확하다.
 */
public final class TitleHeadingLinkStrategy implements LinkStrategy {

    public static final String DEFAULT_SELECTOR = "h3.entry-title";

    private final String headingSelector;

    public TitleHeadingLinkStrategy() { this(DEFAULT_SELECTOR); }

    public TitleHeadingLinkStrategy(String headingSelector) {
        this.headingSelector = Objects.requireNonNull(headingSelector, "headingSelector");
    }

    @Override public String name() { return "title-heading"; }

    @Override
    public List<String> candidates(Element scope) {
        List<String> out = new ArrayList<>();
        for (Element heading : scope.select(headingSelector)) {
            Element a = heading.selectFirst("a[href]");
            if (a == null) continue;
            out.add(LinkHrefs.absHref(a));
        }
        return out;
    }
}
