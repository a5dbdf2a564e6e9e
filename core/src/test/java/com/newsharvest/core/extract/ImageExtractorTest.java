package com.newsharvest.core.extract;

import com.newsharvest.core.model.ImageRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageExtractorTest {

    private static final String URL = "https://www.nrinow.news/2025/03/20/story/";

    private final ImageExtractor extractor = new ImageExtractor();

    private static Document parse(String head, String body) {
        return Jsoup.parse("<html><head>" + head + "</head><body>" + body + "</body></html>", URL);
    }

    @Test
    @DisplayName("OG 이미지 + 본문 이미지 2장(하나는 OG 중복) → 정확히 2건")
    void og_image_plus_body_images_with_duplicate() {
        String og = "https://www.nrinow.news/wp-content/uploads/2025/03/hero.jpg";
        Document dom = parse("<meta property='og:image' content='" + og + "'>",
                "<div class='td-post-content'>"
                        + "<img src='" + og + "' width='800' height='600'>"
                        + "<img src='/wp-content/uploads/2025/03/second.jpg' alt='Second' width='640' height='480'>"
                        + "</div>");

        List<ImageRecord> images = extractor.extractImages(dom, URL);

        assertThat(images).extracting(ImageRecord::sourceUrl)
                .containsExactly(og, "https://www.nrinow.news/wp-content/uploads/2025/03/second.jpg");
        assertThat(images.get(0).altText()).isEqualTo(ImageRecord.FEATURED);
        assertThat(images.get(0).width()).isNull();
        assertThat(images.get(1).altText()).isEqualTo("Second");
        assertThat(images.get(1).width()).isEqualTo(640);
    }

    @Test
    void twitter_image_used_when_no_og() {
        Document dom = parse("<meta name='twitter:image' content='//cdn.example.com/t.jpg'>", "");
        assertThat(extractor.extractImages(dom, URL)).extracting(ImageRecord::sourceUrl)
                .containsExactly("https://cdn.example.com/t.jpg");
    }

    @Test
    void filters_small_and_decorative_images() {
        Document dom = parse("", "<article>"
                + "<img src='https://cdn.example.com/spacer.gif' width='1' height='1'>"
                + "<img src='https://cdn.example.com/ok-with-bad-dims.jpg' width='100%' height='20'>"
                + "<img src='https://s.w.org/images/core/emoji/15/svg/1f600.svg'>"
                + "<img src='https://secure.gravatar.com/avatar/abc'>"
                + "<img src='https://cdn.example.com/icon-share.png'>"
                + "<img src='https://cdn.printfriendly.com/buttons/pf-button.gif'>"
                + "<img src='https://cdn.example.com/photo.jpg' width='40'>"
                + "</article>");

        assertThat(extractor.extractImages(dom, URL)).extracting(ImageRecord::sourceUrl)
                .containsExactly("https://cdn.example.com/ok-with-bad-dims.jpg", "https://cdn.example.com/photo.jpg");
    }

    @Test
    void lazy_loaded_src_and_relative_urls_are_resolved() {
        Document dom = parse("", "<div class='entry-content'>"
                + "<img src='data:image/gif;base64,R0lGOD' data-src='images/lazy.jpg'>"
                + "<img data-src='//cdn.example.com/proto.jpg'>"
                + "<img alt='no source'>"
                + "</div>");

        assertThat(extractor.extractImages(dom, URL)).extracting(ImageRecord::sourceUrl)
                .containsExactly("https://www.nrinow.news/2025/03/20/story/images/lazy.jpg",
                        "https://cdn.example.com/proto.jpg");
    }

    @Test
    void only_content_areas_when_present() {
        Document dom = parse("", "<header><img src='https://cdn.example.com/logo.jpg'></header>"
                + "<div class='pf-content'><img src='https://cdn.example.com/body.jpg'></div>");

        assertThat(extractor.extractImages(dom, URL)).extracting(ImageRecord::sourceUrl)
                .containsExactly("https://cdn.example.com/body.jpg");
    }

    @Test
    void captions_from_figure_or_sibling() {
        Document dom = parse("", "<article>"
                + "<figure><img src='https://cdn.example.com/a.jpg'><figcaption>Mayor speaks</figcaption></figure>"
                + "<div><img src='https://cdn.example.com/b.jpg'><p class='wp-caption-text'>Crowd outside</p></div>"
                + "<div><img src='https://cdn.example.com/c.jpg'></div>"
                + "</article>");

        assertThat(extractor.extractImages(dom, URL)).extracting(ImageRecord::caption)
                .containsExactly("Mayor speaks", "Crowd outside", "");
    }

    @Test
    void image_urls_are_unique_even_across_nested_areas() {
        Document dom = parse("", "<article><div class='td-post-content'>"
                + "<img src='https://cdn.example.com/x.jpg'><img src='https://cdn.example.com/x.jpg'>"
                + "</div></article>");

        assertThat(extractor.extractImages(dom, URL)).hasSize(1);
    }
}
