package com.newsharvest.core.extract;

import com.newsharvest.core.model.ImageRecord;
import com.newsharvest.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 기사 이미지 추출: 대표 이미지(og:image → twitter:image) 먼저, 이어서 본문 이미지.
 * URL 기준 중복 제거, 아이콘/스페이서/장식 자산은 걸러낸다.
 */
public final class ImageExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ImageExtractor.class);

    public static final String CONTENT_AREAS = ".pf-content, .td-post-content, .entry-content, article";
    public static final List<String> DENYLIST = List.of("emoji", "printfriendly", "gravatar", "icon-", "button");
    public static final int MIN_DIMENSION = 50;

    public List<ImageRecord> extractImages(Document dom, String baseUrl) {
        Map<String, ImageRecord> accepted = new LinkedHashMap<>(); // sourceUrl → record (순서 유지)

        featuredImage(dom, baseUrl).ifPresent(img -> accepted.put(img.sourceUrl(), img));

        for (Element img : candidates(dom)) {
            try {
                toRecord(img, baseUrl)
                        .filter(r -> !accepted.containsKey(r.sourceUrl()))
                        .ifPresent(r -> accepted.put(r.sourceUrl(), r));
            } catch (RuntimeException e) {
                // 이미지 단위 실패는 건너뜀
                LOG.debug("Skipping image {}: {}", img.attr("src"), e.toString());
            }
        }
        return new ArrayList<>(accepted.values());
    }

    /** og:image, 없으면 twitter:image */
    Optional<ImageRecord> featuredImage(Document dom, String baseUrl) {
        String raw = metaContent(dom, "meta[property=og:image]");
        if (raw == null) raw = metaContent(dom, "meta[name=twitter:image]");
        if (raw == null) return Optional.empty();
        String abs = UrlUtils.toAbsolute(raw, baseUrl);
        return abs == null ? Optional.empty() : Optional.of(ImageRecord.featured(abs));
    }

    private static String metaContent(Document dom, String query) {
        Element meta = dom.selectFirst(query);
        if (meta == null) return null;
        String c = meta.attr("content").trim();
        return c.isEmpty() ? null : c;
    }

    /** 콘텐츠 영역이 있으면 그 안의 img 만, 없으면 페이지 전체 */
    private static List<Element> candidates(Document dom) {
        Elements areas = dom.select(CONTENT_AREAS);
        if (areas.isEmpty()) return dom.select("img");
        // 영역이 중첩될 수 있으므로 동일 요소는 한 번만
        List<Element> out = new ArrayList<>();
        for (Element area : areas) {
            for (Element img : area.select("img")) {
                if (out.stream().noneMatch(e -> e == img)) out.add(img);
            }
        }
        return out;
    }

    private Optional<ImageRecord> toRecord(Element img, String baseUrl) {
        String src = img.attr("src").trim();
        if (src.isEmpty() || src.toLowerCase(Locale.ROOT).startsWith("data:")) {
            src = img.attr("data-src").trim(); // 지연 로딩
        }
        if (src.isEmpty()) return Optional.empty();

        String abs = UrlUtils.toAbsolute(src, baseUrl);
        if (abs == null) return Optional.empty();

        Integer w = parseDimension(img.attr("width"));
        Integer h = parseDimension(img.attr("height"));
        if (w != null && h != null && (w < MIN_DIMENSION || h < MIN_DIMENSION)) return Optional.empty();

        String lower = abs.toLowerCase(Locale.ROOT);
        if (DENYLIST.stream().anyMatch(lower::contains)) return Optional.empty();

        return Optional.of(new ImageRecord(abs,
                img.attr("alt").trim(),
                img.attr("title").trim(),
                w, h,
                String.join(" ", img.classNames()),
                caption(img)));
    }

    static Integer parseDimension(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return null; // "100%", "auto" 등
        }
    }

    /** figure>figcaption, 없으면 부모 안의 class*=caption 인 p/div/span */
    static String caption(Element img) {
        Element figure = img.closest("figure");
        if (figure != null) {
            Element fc = figure.selectFirst("figcaption");
            if (fc != null) return fc.text().trim();
        }
        Element parent = img.parent();
        if (parent != null) {
            for (Element el : parent.select("p, div, span")) {
                if (el != parent && el.className().toLowerCase(Locale.ROOT).contains("caption")) {
                    return el.text().trim();
                }
            }
        }
        return "";
    }
}
