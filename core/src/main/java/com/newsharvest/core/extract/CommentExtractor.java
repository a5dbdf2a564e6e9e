package com.newsharvest.core.extract;

import com.newsharvest.core.model.CommentRecord;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 댓글 트리 추출. 절대 빈 리스트를 돌려주지 않는다:
 * 실제 댓글이 없으면 METADATA 센티널 한 건(댓글 수 진단 포함).
 * 구조화 목록 형태를 먼저, 없으면 일반 셀렉터 형태. 페이지에 있는 첫 형태만 쓴다
 * (구조화 목록의 항목이 모두 걸러졌다고 같은 마크업을 일반 셀렉터로 다시 줍지 않는다).
 */
public final class CommentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(CommentExtractor.class);

    private final List<CommentShape> shapes;

    public CommentExtractor() {
        this(List.of(new StructuredCommentShape(), new GenericCommentShape()));
    }

    public CommentExtractor(List<CommentShape> shapes) {
        this.shapes = List.copyOf(shapes);
    }

    public List<CommentRecord> extractComments(Document dom) {
        CommentFilter filter = new CommentFilter();
        for (CommentShape shape : shapes) {
            if (!shape.present(dom)) continue;
            List<CommentRecord> found = shape.extract(dom, filter);
            if (found.isEmpty()) break;
            LOG.info("Successfully extracted {} comments/replies ({})", found.size(), shape.name());
            return found;
        }
        return List.of(sentinel(dom));
    }

    /** 어느 단계에서 비었는지에 따라 메시지를 달리한다 */
    static CommentRecord sentinel(Document dom) {
        int count = CommentCountReader.read(dom);
        String reason;
        if (StructuredCommentShape.container(dom) == null) {
            reason = "No comments section found";
        } else if (StructuredCommentShape.commentList(dom) == null) {
            reason = "No comment list found";
        } else {
            reason = "No comments extracted";
        }
        return CommentRecord.metadata(reason + " (Comment count: " + count + ")");
    }
}
