package com.newsharvest.core.api;

import com.newsharvest.core.model.FetchedPage;

import java.net.URI;
import java.util.Optional;

/**
 * URL → 렌더링된 HTML. 브라우저 자동화/스텔스 계층은 이 계약 뒤에 숨는다.
 * 실패(타임아웃/네트워크/차단)는 예외가 아니라 Optional.empty() 로 보고한다.
 */
@FunctionalInterface
public interface IPageFetcher extends AutoCloseable {
    Optional<FetchedPage> fetch(URI url);
    @Override default void close() throws Exception {}
}
