package com.newsharvest.core.extract;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 태그 목록 중 class 속성에 토큰 하나라도 들어있는 첫 요소의 텍스트.
 * 문서 순서 기준, 텍스트가 빈 요소는 건너뛴다.
 */
public final class ClassTokenStrategy implements TextFieldStrategy {

    private final String name;
    private final String tagQuery;
    private final List<String> tokens;

    public ClassTokenStrategy(String name, List<String> tags, List<String> tokens) {
        if (tags.isEmpty() || tokens.isEmpty()) throw new IllegalArgumentException("tags/tokens must not be empty");
        this.name = name;
        this.tagQuery = String.join(", ", tags);
        this.tokens = tokens.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
    }

    /** h1/h2 + title|headline|entry-title */
    public static ClassTokenStrategy title() {
        return new ClassTokenStrategy("heading-title", List.of("h1", "h2"), List.of("title", "headline", "entry-title"));
    }

    public static ClassTokenStrategy author() {
        return new ClassTokenStrategy("class-author", List.of("span", "div", "p"), List.of("author"));
    }

    public static ClassTokenStrategy date() {
        return new ClassTokenStrategy("class-date", List.of("time", "span"), List.of("date", "published", "time"));
    }

    @Override public String name() { return name; }

    @Override
    public Optional<String> extract(Element root) {
        for (Element el : root.select(tagQuery)) {
            String cls = el.className().toLowerCase(Locale.ROOT);
            if (cls.isEmpty() || tokens.stream().noneMatch(cls::contains)) continue;
            String text = el.text().trim();
            if (!text.isEmpty()) return Optional.of(text);
        }
        return Optional.empty();
    }
}
