package com.newsharvest.core.crawler;

import java.util.ArrayList;
import java.util.List;

/** 테스트용 nrinow 템플릿 모양 HTML 조각 */
public final class Fixtures {
    private Fixtures() {}

    public static final String ORIGIN = "https://www.nrinow.news/";

    public static String article(int n) {
        return ORIGIN + "2025/03/20/story-" + n + "/";
    }

    public static List<String> articles(int from, int count) {
        List<String> out = new ArrayList<>();
        for (int i = from; i < from + count; i++) out.add(article(i));
        return out;
    }

    /** 검색 결과 페이지: 결과 영역 + (선택) "Page X of Y" 라벨 */
    public static String resultsPage(List<String> urls, String pageLabel) {
        StringBuilder sb = new StringBuilder("<html><body>");
        sb.append("<div class='td-header-menu'><a href='").append(ORIGIN).append("2024/01/01/menu-link/'>Menu</a></div>");
        sb.append("<div class='td-main-content-wrap'>");
        for (String u : urls) {
            sb.append("<div class='td_module_16'><h3 class='entry-title td-module-title'><a href='")
              .append(u).append("'>Title</a></h3>")
              .append("<a href='").append(u).append("#comments'>0</a></div>");
        }
        if (pageLabel != null) {
            sb.append("<div class='page-nav td-pb-padding-side'><span class='pages'>")
              .append(pageLabel).append("</span></div>");
        }
        sb.append("</div></body></html>");
        return sb.toString();
    }
}
