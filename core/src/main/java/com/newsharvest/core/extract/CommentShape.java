package com.newsharvest.core.extract;

import com.newsharvest.core.model.CommentRecord;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * 댓글 마크업 형태 하나(템플릿 버전별).
 * present() 가 참인 첫 형태가 그 페이지의 형태로 확정되고, 결과가 비어도 다음 형태로 넘어가지 않는다.
 */
public interface CommentShape {
    String name();

    /** 이 형태의 마크업이 페이지에 있는가 */
    boolean present(Document dom);

    /** 필터를 통과한 댓글(없으면 빈 리스트) */
    List<CommentRecord> extract(Document dom, CommentFilter filter);
}
