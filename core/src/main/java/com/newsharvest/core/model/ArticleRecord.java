package com.newsharvest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * 기사 한 건의 추출 결과. 기사 URL당 한 번 생성되고 이후 불변.
 * success=false 이면 images/comments 는 빈 리스트, bodyText 는 "" 로 강제된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"url", "success", "error", "title", "author", "publishDateRaw",
        "bodyLength", "bodyText", "images", "comments", "searchHit"})
public final class ArticleRecord {

    public static final String NO_TITLE = "No title found";
    public static final String UNKNOWN = "Unknown";
    public static final String LOAD_FAILED = "Failed to load page";

    private final String url;
    private final String title;
    private final String bodyText;
    private final String author;
    private final String publishDateRaw;
    private final List<ImageRecord> images;
    private final List<CommentRecord> comments;
    private final boolean success;
    private final String error;
    private final SearchHit searchHit;

    private ArticleRecord(Builder b) {
        this.url = b.url;
        this.success = b.success;
        this.error = b.error;
        this.title = (b.title == null || b.title.isBlank()) ? NO_TITLE : b.title;
        this.author = (b.author == null || b.author.isBlank()) ? UNKNOWN : b.author;
        this.publishDateRaw = (b.publishDateRaw == null || b.publishDateRaw.isBlank()) ? UNKNOWN : b.publishDateRaw;
        if (b.success) {
            this.bodyText = (b.bodyText == null) ? "" : b.bodyText;
            this.images = (b.images == null) ? List.of() : List.copyOf(b.images);
            this.comments = (b.comments == null) ? List.of() : List.copyOf(b.comments);
        } else {
            this.bodyText = "";
            this.images = List.of();
            this.comments = List.of();
        }
        this.searchHit = b.searchHit;
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getBodyText() { return bodyText; }
    public String getAuthor() { return author; }
    public String getPublishDateRaw() { return publishDateRaw; }
    public int getBodyLength() { return bodyText.length(); }
    public List<ImageRecord> getImages() { return images; }
    public List<CommentRecord> getComments() { return comments; }
    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public SearchHit getSearchHit() { return searchHit; }

    /** METADATA 센티널을 제외한 실제 댓글 수 */
    @JsonIgnore
    public int getRealCommentCount() {
        return (int) comments.stream().filter(CommentRecord::isReal).count();
    }

    /** 검색 메타만 덧붙인 사본. 나머지 필드는 그대로. */
    public ArticleRecord withSearchHit(SearchHit hit) {
        return toBuilder().searchHit(hit).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .url(url).title(title).bodyText(bodyText).author(author)
                .publishDateRaw(publishDateRaw).images(images).comments(comments)
                .success(success).error(error).searchHit(searchHit);
    }

    public static ArticleRecord failure(String url, String error) {
        return builder().url(url).success(false).error(error).build();
    }

    @Override
    public String toString() {
        return "ArticleRecord{url=" + url + ", success=" + success
                + (success ? ", title=" + title + ", bodyLength=" + getBodyLength() : ", error=" + error) + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String title;
        private String bodyText;
        private String author;
        private String publishDateRaw;
        private List<ImageRecord> images;
        private List<CommentRecord> comments;
        private boolean success = true;
        private String error;
        private SearchHit searchHit;

        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder bodyText(String bodyText) { this.bodyText = bodyText; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder publishDateRaw(String publishDateRaw) { this.publishDateRaw = publishDateRaw; return this; }
        public Builder images(List<ImageRecord> images) { this.images = images; return this; }
        public Builder comments(List<CommentRecord> comments) { this.comments = comments; return this; }
        public Builder success(boolean success) { this.success = success; return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder searchHit(SearchHit searchHit) { this.searchHit = searchHit; return this; }

        public ArticleRecord build() {
            Objects.requireNonNull(url, "url");
            return new ArticleRecord(this);
        }
    }
}
