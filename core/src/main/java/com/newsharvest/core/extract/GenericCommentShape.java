package com.newsharvest.core.extract;

import com.newsharvest.core.model.CommentKind;
import com.newsharvest.core.model.CommentRecord;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 댓글 플러그인에서 흔한 셀렉터 우선순위 목록.
 * 결과를 낸 첫 셀렉터만 쓴다(래퍼와 내부 텍스트 노드가 함께 잡히는 것 방지).
 */
public final class GenericCommentShape implements CommentShape {

    private static final Logger LOG = LoggerFactory.getLogger(GenericCommentShape.class);

    public static final List<String> ITEM_SELECTORS = List.of(
            ".wpd-comment",
            ".comment-body",
            "li.comment",
            "div.comment",
            "[class*=comment-item]",
            "[id^=comment-]");

    static final List<String> TEXT_SELECTORS = List.of(".comment-content", ".comment-text", ".comment-body", "p");
    static final List<String> AUTHOR_SELECTORS =
            List.of(".comment-author", ".comment-author-name", ".author", "[class*=author]");
    static final List<String> DATE_SELECTORS =
            List.of(".comment-date", ".comment-time", "time", ".date", "[class*=date]", "[class*=time]");

    private final List<String> itemSelectors;

    public GenericCommentShape() {
        this(ITEM_SELECTORS);
    }

    public GenericCommentShape(List<String> itemSelectors) {
        this.itemSelectors = List.copyOf(itemSelectors);
    }

    @Override public String name() { return "generic-selectors"; }

    @Override
    public boolean present(Document dom) {
        return itemSelectors.stream().anyMatch(sel -> dom.selectFirst(sel) != null);
    }

    @Override
    public List<CommentRecord> extract(Document dom, CommentFilter filter) {
        for (String selector : itemSelectors) {
            Elements items = dom.select(selector);
            if (items.isEmpty()) continue;

            List<CommentRecord> out = new ArrayList<>();
            for (Element item : items) {
                try {
                    CommentRecord c = toRecord(item);
                    if (filter.accept(c)) out.add(c);
                } catch (RuntimeException e) {
                    LOG.debug("Skipping comment element: {}", e.toString());
                }
            }
            if (!out.isEmpty()) {
                LOG.debug("{} comment(s) via '{}'", out.size(), selector);
                return out;
            }
        }
        return List.of();
    }

    private static CommentRecord toRecord(Element item) {
        Element copy = item.clone();
        copy.select("script, style, button, form").remove();

        String text = null;
        for (String sel : TEXT_SELECTORS) {
            Element el = copy.selectFirst(sel);
            if (el == null) continue;
            String t = el.text().trim();
            if (t.length() > 10) {
                text = t;
                break;
            }
        }
        if (text == null) text = copy.text().trim();

        String id = item.id().startsWith("comment-") ? item.id().substring("comment-".length()) : null;
        return new CommentRecord(id, text, firstText(copy, AUTHOR_SELECTORS), firstText(copy, DATE_SELECTORS),
                CommentKind.COMMENT);
    }

    private static String firstText(Element root, List<String> selectors) {
        for (String sel : selectors) {
            Element el = root.selectFirst(sel);
            if (el == null) continue;
            String t = el.text().trim();
            if (!t.isEmpty()) return t;
        }
        return null;
    }
}
