package com.newsharvest.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 절대 URL 해석 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final Logger LOG = LoggerFactory.getLogger(UrlUtils.class);

    /** URI 문법상 그대로 둘 수 없는 문자(CDN 쿼리에 흔함). [ ] 는 호스트 뒤에서만. */
    private static final String ILLEGAL = " \"<>\\^`{|}";
    private static final Pattern SCHEME_AUTHORITY = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]*://");

    /**
     * base 기준으로 href/src 를 절대 URL 로 바꾼다.
     * <ul>
     *   <li>{@code //cdn/x.jpg} → base 의 scheme (없으면 https) 적용</li>
     *   <li>{@code /x.jpg}, {@code x.jpg} → base 기준 resolve</li>
     *   <li>공백, {@code | { } [ ] " < > ^ `} 등 URI 에 못 쓰는 문자는 퍼센트 인코딩</li>
     * </ul>
     * 해석 불가/비 http(s) 면 null.
     */
    public static String toAbsolute(String raw, String base) {
        if (raw == null) return null;
        String s = encodeIllegal(raw.trim());
        if (s.isEmpty()) return null;
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data:") || lower.startsWith("javascript:") || lower.startsWith("mailto:")) return null;

        try {
            if (s.startsWith("//")) {
                String scheme = "https";
                if (base != null) {
                    String bs = URI.create(base).getScheme();
                    if (bs != null) scheme = bs.toLowerCase(Locale.ROOT);
                }
                return checkHttp(URI.create(scheme + ":" + s));
            }
            URI u = URI.create(s);
            if (u.isAbsolute()) return checkHttp(u);
            if (base == null || base.isBlank()) return null;
            return checkHttp(URI.create(base.trim()).resolve(u));
        } catch (IllegalArgumentException e) {
            LOG.debug("Unresolvable URL '{}' (base {}): {}", raw, base, e.getMessage());
            return null;
        }
    }

    /** 이미 인코딩된 %XX 는 유지하고 금지 문자만 UTF-8 퍼센트 인코딩 */
    static String encodeIllegal(String s) {
        int authorityEnd = authorityEnd(s);
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean bad = ILLEGAL.indexOf(c) >= 0 || c < 0x20 || c == 0x7f
                    || ((c == '[' || c == ']') && i >= authorityEnd);
            if (!bad) {
                if (sb != null) sb.append(c);
                continue;
            }
            if (sb == null) sb = new StringBuilder(s.length() + 16).append(s, 0, i);
            for (byte b : String.valueOf(c).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(String.format("%02X", b & 0xff));
            }
        }
        return (sb == null) ? s : sb.toString();
    }

    /** scheme://host[:port] 다음 위치. 상대 URL 이면 0 */
    private static int authorityEnd(String s) {
        int start;
        if (s.startsWith("//")) {
            start = 2;
        } else {
            Matcher m = SCHEME_AUTHORITY.matcher(s);
            if (!m.lookingAt()) return 0;
            start = m.end();
        }
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' || c == '?' || c == '#') return i;
        }
        return s.length();
    }

    private static String checkHttp(URI u) {
        String sc = u.getScheme();
        if (sc == null) return null;
        if (!sc.equalsIgnoreCase("http") && !sc.equalsIgnoreCase("https")) return null;
        return u.toString();
    }
}
