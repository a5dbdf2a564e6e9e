package com.newsharvest.core.model;

/** 댓글 레코드 종류. METADATA는 실제 댓글이 없을 때 내보내는 진단용 센티널. */
public enum CommentKind {
    COMMENT,
    REPLY,
    METADATA;

    public boolean isReal() { return this != METADATA; }
}
