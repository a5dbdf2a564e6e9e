package com.newsharvest.core.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 세션 동안 이미 발견/예약된 URL 집합. append-only.
 * 외부에서 넘겨받은 seen 집합은 seed 로 들어가며, 발견 목록(discovered)에는 포함되지 않는다.
 */
public final class DedupFrontier {

    private final Set<String> known = new LinkedHashSet<>();
    private final Set<String> discovered = new LinkedHashSet<>(); // 이번 세션에서 새로 받은 것(발견 순서)

    public DedupFrontier() {}

    public DedupFrontier(Collection<String> alreadySeen) {
        seed(alreadySeen);
    }

    /** 외부 seen/exclude 집합 등록. 결과로는 내보내지 않는다. */
    public void seed(Collection<String> alreadySeen) {
        if (alreadySeen == null) return;
        for (String u : alreadySeen) {
            if (u != null && !u.isBlank()) known.add(u);
        }
    }

    /** 처음 보는 URL이면 등록 후 true */
    public boolean offer(String url) {
        if (url == null || url.isBlank()) return false;
        if (!known.add(url)) return false;
        discovered.add(url);
        return true;
    }

    public boolean contains(String url) {
        return url != null && known.contains(url);
    }

    /** 링크 추출기에 넘길 제외 집합(읽기 전용 뷰) */
    public Set<String> excludeView() {
        return java.util.Collections.unmodifiableSet(known);
    }

    /** 이번 세션에서 새로 발견된 URL (발견 순서) */
    public List<String> discovered() {
        return List.copyOf(discovered);
    }

    public int size() { return discovered.size(); }
}
