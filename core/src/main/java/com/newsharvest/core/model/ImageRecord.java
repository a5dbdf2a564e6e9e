package com.newsharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.net.URI;
import java.util.Objects;

/**
 * 기사 내 이미지 한 장.
 * sourceUrl은 항상 절대 URL (상대/프로토콜 상대 형태는 생성 시점에 기사 URL 기준으로 해석).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageRecord(String sourceUrl,
                          String altText,
                          String titleText,
                          Integer width,
                          Integer height,
                          String cssClasses,
                          String caption) {

    public static final String FEATURED = "Featured Image";

    public ImageRecord {
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        if (!URI.create(sourceUrl).isAbsolute()) {
            throw new IllegalArgumentException("sourceUrl must be absolute: " + sourceUrl);
        }
        altText = (altText == null) ? "" : altText;
        titleText = (titleText == null) ? "" : titleText;
        cssClasses = (cssClasses == null) ? "" : cssClasses;
        caption = (caption == null) ? "" : caption;
    }

    /** og:image / twitter:image 에서 합성한 대표 이미지 */
    public static ImageRecord featured(String absoluteUrl) {
        return new ImageRecord(absoluteUrl, FEATURED, FEATURED, null, null, "featured-image", FEATURED);
    }
}
