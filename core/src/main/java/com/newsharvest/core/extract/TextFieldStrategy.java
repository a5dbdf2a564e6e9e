package com.newsharvest.core.extract;

import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * "X 를 뽑아 본다" 한 가지 방법. 폴백 체인의 한 칸.
 * 못 찾으면 Optional.empty() (예외 아님).
 */
public interface TextFieldStrategy {
    String name();
    Optional<String> extract(Element root);
}
