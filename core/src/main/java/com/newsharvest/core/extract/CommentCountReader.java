package com.newsharvest.core.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 페이지가 주장하는 댓글 수. 진단 메시지에만 쓰고 실제 추출 결과와 대조하지 않는다.
 * h4.td-comments-title("5 COMMENTS") → 구조화 목록 항목 수 → .td-post-comments a → 0
 */
final class CommentCountReader {
    private CommentCountReader() {}

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    static int read(Document dom) {
        Integer n = firstNumber(dom.selectFirst("h4.td-comments-title"));
        if (n != null) return n;

        int items = StructuredCommentShape.itemCount(dom);
        if (items >= 0) return items;

        n = firstNumber(dom.selectFirst(".td-post-comments a"));
        return (n != null) ? n : 0;
    }

    private static Integer firstNumber(Element el) {
        if (el == null) return null;
        Matcher m = NUMBER.matcher(el.text());
        if (!m.find()) return null;
        try {
            return Integer.parseInt(m.group());
        } catch (NumberFormatException e) {
            return null; // 자릿수 초과
        }
    }
}
