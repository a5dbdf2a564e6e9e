package com.newsharvest.core.crawler;

import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 페이지 내비의 "Page X of Y" 라벨, X &lt; Y 이면 다음 있음 */
public final class PageOfLabelSignal implements NextPageSignal {

    private static final Pattern LABEL = Pattern.compile("Page\\s+(\\d+)\\s+of\\s+(\\d+)", Pattern.CASE_INSENSITIVE);

    @Override public String name() { return "page-of-label"; }

    @Override
    public boolean hasNext(PageContext ctx) {
        Element label = ctx.dom().selectFirst("div.page-nav span.pages");
        if (label == null) label = ctx.dom().selectFirst("span.pages");
        if (label == null) return false;

        Matcher m = LABEL.matcher(label.text());
        if (!m.find()) return false;
        try {
            int current = Integer.parseInt(m.group(1));
            int total = Integer.parseInt(m.group(2));
            return current < total;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
