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
 * WordPress 기본 댓글 목록: #comments/.comments → ol.comment-list → li.comment.
 * 답글은 조상에 .children 목록이 있는 항목.
 */
public final class StructuredCommentShape implements CommentShape {

    private static final Logger LOG = LoggerFactory.getLogger(StructuredCommentShape.class);

    public static final String CONTAINER = "#comments, .comments";
    public static final String LIST = "ol.comment-list";
    public static final String ITEM = "li.comment";

    @Override public String name() { return "structured-list"; }

    /**
     * 댓글 영역. 목록을 품은 #comments 우선, 다음은 목록을 품은 아무 후보.
     * 목록이 어디에도 없으면 #comments, 그것도 없으면 문서상 첫 후보(없으면 null).
     * 헤더의 댓글 수 배지처럼 앞쪽에 놓인 .comments 가 실제 영역을 가리지 않게 한다.
     */
    static Element container(Document dom) {
        Element byId = dom.getElementById("comments");
        if (byId != null && byId.selectFirst(LIST) != null) return byId;
        Elements candidates = dom.select(CONTAINER);
        for (Element c : candidates) {
            if (c.selectFirst(LIST) != null) return c;
        }
        return (byId != null) ? byId : candidates.first();
    }

    /** 컨테이너 → 목록. 없으면 null */
    static Element commentList(Document dom) {
        Element container = container(dom);
        return (container == null) ? null : container.selectFirst(LIST);
    }

    /** 목록 안의 항목 수(답글 포함). 목록이 없으면 -1 */
    static int itemCount(Document dom) {
        Element list = commentList(dom);
        return (list == null) ? -1 : list.select(ITEM).size();
    }

    @Override
    public boolean present(Document dom) {
        return commentList(dom) != null;
    }

    @Override
    public List<CommentRecord> extract(Document dom, CommentFilter filter) {
        Element list = commentList(dom);
        if (list == null) return List.of();

        List<CommentRecord> out = new ArrayList<>();
        for (Element item : list.select(ITEM)) {
            try {
                CommentRecord c = toRecord(item, list);
                if (c != null && filter.accept(c)) out.add(c);
            } catch (RuntimeException e) {
                LOG.debug("Skipping comment {}: {}", item.id(), e.toString());
            }
        }
        return out;
    }

    private static CommentRecord toRecord(Element item, Element list) {
        Element own = ownPart(item);
        Element content = own.selectFirst(".comment-content");
        if (content == null) return null;

        Element cite = own.selectFirst("cite");
        Element time = own.selectFirst("time");
        String id = item.id().isEmpty() ? null : item.id().replaceFirst("^comment-", "");
        CommentKind kind = isReply(item, list) ? CommentKind.REPLY : CommentKind.COMMENT;

        return new CommentRecord(id,
                content.text().trim(),
                cite == null ? null : cite.text().trim(),
                time == null ? null : time.text().trim(),
                kind);
    }

    /** 항목 자신의 부분만: 직계 article, 없으면 하위 답글 목록을 걷어낸 사본 */
    private static Element ownPart(Element item) {
        for (Element child : item.children()) {
            if (child.tagName().equals("article")) return child;
        }
        Element copy = item.clone();
        copy.select(".children").remove();
        return copy;
    }

    private static boolean isReply(Element item, Element list) {
        for (Element p = item.parent(); p != null && p != list; p = p.parent()) {
            if (p.hasClass("children")) return true;
        }
        return false;
    }
}
