package com.newsharvest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * 댓글 한 건.
 * id는 마크업에 식별자가 있을 때만 채워진다(null 허용).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommentRecord(String id, String text, String author, String dateRaw, CommentKind kind) {

    public static final String SYSTEM_AUTHOR = "System";
    public static final String NO_DATE = "N/A";

    public CommentRecord {
        text = (text == null) ? "" : text;
        author = (author == null || author.isBlank()) ? "Anonymous" : author;
        dateRaw = (dateRaw == null || dateRaw.isBlank()) ? "Unknown" : dateRaw;
        Objects.requireNonNull(kind, "kind");
    }

    /** 실제 댓글이 없을 때 반환되는 진단 레코드 */
    public static CommentRecord metadata(String message) {
        return new CommentRecord(null, message, SYSTEM_AUTHOR, NO_DATE, CommentKind.METADATA);
    }

    public int length() { return text.length(); }

    @JsonIgnore
    public boolean isReal() { return kind.isReal(); }
}
