package com.newsharvest.core.extract;

import com.newsharvest.core.model.CommentRecord;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 모든 형태에 똑같이 적용되는 댓글 필터.
 * 짧은 텍스트/폼 문구 제거, id 가 있으면 id 로, 없으면 텍스트 완전 일치로 중복 제거.
 * 한 번의 추출 호출 동안만 쓴다(상태 보유).
 */
public final class CommentFilter {

    public static final int MIN_TEXT_CHARS = 10;
    public static final List<String> NON_CONTENT =
            List.of("leave a reply", "cancel reply", "comment:", "your email");

    private final Set<String> seenIds = new HashSet<>();
    private final Set<String> seenTexts = new HashSet<>();

    /** 텍스트 자체가 댓글 내용으로 볼 만한가 */
    public static boolean isContent(String text) {
        if (text == null) return false;
        String t = text.trim();
        if (t.length() < MIN_TEXT_CHARS) return false;
        String lower = t.toLowerCase(Locale.ROOT);
        return NON_CONTENT.stream().noneMatch(lower::contains);
    }

    /** 통과하면 등록하고 true */
    public boolean accept(CommentRecord c) {
        if (!isContent(c.text())) return false;
        if (c.id() != null && !c.id().isEmpty()) {
            return seenIds.add(c.id());
        }
        return seenTexts.add(c.text());
    }
}
