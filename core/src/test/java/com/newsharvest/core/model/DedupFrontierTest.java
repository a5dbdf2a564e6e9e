package com.newsharvest.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DedupFrontierTest {

    @Test
    void offer_accepts_each_url_once_in_discovery_order() {
        DedupFrontier f = new DedupFrontier();
        assertThat(f.offer("https://a/2025/1/")).isTrue();
        assertThat(f.offer("https://a/2025/2/")).isTrue();
        assertThat(f.offer("https://a/2025/1/")).isFalse();
        assertThat(f.offer(null)).isFalse();
        assertThat(f.offer(" ")).isFalse();

        assertThat(f.discovered()).containsExactly("https://a/2025/1/", "https://a/2025/2/");
        assertThat(f.size()).isEqualTo(2);
    }

    @Test
    void seeded_urls_are_excluded_but_not_reported_as_discovered() {
        DedupFrontier f = new DedupFrontier(List.of("https://a/seen/"));
        assertThat(f.contains("https://a/seen/")).isTrue();
        assertThat(f.offer("https://a/seen/")).isFalse();
        assertThat(f.excludeView()).contains("https://a/seen/");
        assertThat(f.discovered()).isEmpty();
        assertThat(f.size()).isZero();
    }

    @Test
    void exclude_view_is_read_only() {
        DedupFrontier f = new DedupFrontier();
        assertThatThrownBy(() -> f.excludeView().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void search_session_budgets() {
        SearchSession s = new SearchSession("kw", 2, 1);
        assertThat(s.getSessionId()).hasSize(8);
        assertThat(s.articleBudgetReached()).isFalse();
        s.getFrontier().offer("u1");
        s.getFrontier().offer("u2");
        assertThat(s.articleBudgetReached()).isTrue();

        assertThat(s.pageBudgetReached()).isFalse();
        s.pageVisited();
        assertThat(s.pageBudgetReached()).isTrue();

        assertThatThrownBy(() -> new SearchSession("kw", 0, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
