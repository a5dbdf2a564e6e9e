package com.newsharvest.core.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 안티봇 챌린지/차단 페이지 마커 탐지.
 * 힌트일 뿐이라 호출자는 경고만 남기고 추출은 계속한다.
 */
public final class ChallengeDetector {
    private ChallengeDetector() {}

    public static final List<String> MARKERS =
            List.of("verify you are human", "cloudflare", "access denied", "challenge");

    /** 발견된 마커 목록(없으면 빈 리스트) */
    public static List<String> markers(String html) {
        List<String> found = new ArrayList<>();
        if (html == null || html.isEmpty()) return found;
        String lower = html.toLowerCase(Locale.ROOT);
        for (String m : MARKERS) {
            if (lower.contains(m)) found.add(m);
        }
        return found;
    }
}
