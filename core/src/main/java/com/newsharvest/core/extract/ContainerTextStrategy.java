package com.newsharvest.core.extract;

import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * 본문 후보 컨테이너 하나(셀렉터 첫 매치).
 * 사본에서 script/style/nav/aside 를 걷어내고 텍스트를 공백 하나로 이어 붙인다.
 * 원본 DOM 은 건드리지 않는다(이미지/댓글 추출기가 같은 문서를 본다).
 */
public final class ContainerTextStrategy implements TextFieldStrategy {

    static final String STRIP = "script, style, nav, aside";

    private final String selector;

    public ContainerTextStrategy(String selector) {
        this.selector = selector;
    }

    @Override public String name() { return selector; }

    @Override
    public Optional<String> extract(Element root) {
        Element container = root.selectFirst(selector);
        if (container == null) return Optional.empty();
        Element copy = container.clone();
        copy.select(STRIP).remove();
        // Element.text() 는 공백을 하나로 정규화한다
        return Optional.of(copy.text().trim());
    }
}
