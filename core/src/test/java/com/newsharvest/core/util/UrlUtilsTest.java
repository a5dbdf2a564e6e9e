package com.newsharvest.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    private static final String BASE = "https://www.nrinow.news/2025/03/20/story/";

    @Test
    void relative_and_root_relative_resolve_against_base() {
        assertEquals("https://www.nrinow.news/2025/03/20/story/pic.jpg", UrlUtils.toAbsolute("pic.jpg", BASE));
        assertEquals("https://www.nrinow.news/wp-content/a.png", UrlUtils.toAbsolute("/wp-content/a.png", BASE));
    }

    @Test
    void protocol_relative_takes_base_scheme() {
        assertEquals("https://cdn.example.com/x.jpg", UrlUtils.toAbsolute("//cdn.example.com/x.jpg", BASE));
        assertEquals("http://cdn.example.com/x.jpg", UrlUtils.toAbsolute("//cdn.example.com/x.jpg", "http://a.test/"));
        assertEquals("https://cdn.example.com/x.jpg", UrlUtils.toAbsolute("//cdn.example.com/x.jpg", null));
    }

    @Test
    void absolute_urls_pass_through_and_spaces_are_encoded() {
        assertEquals("https://img.test/a%20b.jpg", UrlUtils.toAbsolute("  https://img.test/a b.jpg ", BASE));
    }

    @Test
    void cdn_query_characters_are_encoded_instead_of_dropping_the_url() {
        assertEquals("https://cdn.test/img.jpg?w=1%7C2&f=%7Ba%7D",
                UrlUtils.toAbsolute("https://cdn.test/img.jpg?w=1|2&f={a}", BASE));
        assertEquals("https://cdn.test/img.jpg?a%5B0%5D=1",
                UrlUtils.toAbsolute("https://cdn.test/img.jpg?a[0]=1", BASE));
        assertEquals("https://www.nrinow.news/2025/03/20/story/p%5E1.jpg?x=%22y%22",
                UrlUtils.toAbsolute("p^1.jpg?x=\"y\"", BASE));
    }

    @Test
    void existing_escapes_and_ipv6_hosts_are_kept() {
        assertEquals("https://img.test/a%20b.jpg?q=%7C", UrlUtils.toAbsolute("https://img.test/a%20b.jpg?q=%7C", BASE));
        assertEquals("http://[::1]:8080/a%5Bb%5D.jpg", UrlUtils.toAbsolute("http://[::1]:8080/a[b].jpg", BASE));
        assertEquals("https://img.test/%ED%95%9C", UrlUtils.encodeIllegal("https://img.test/%ED%95%9C"));
    }

    @Test
    void unusable_values_are_null() {
        assertNull(UrlUtils.toAbsolute(null, BASE));
        assertNull(UrlUtils.toAbsolute("   ", BASE));
        assertNull(UrlUtils.toAbsolute("data:image/gif;base64,R0lGOD", BASE));
        assertNull(UrlUtils.toAbsolute("javascript:void(0)", BASE));
        assertNull(UrlUtils.toAbsolute("mailto:editor@nrinow.news", BASE));
        assertNull(UrlUtils.toAbsolute("ftp://files.test/a.jpg", BASE));
        assertNull(UrlUtils.toAbsolute("pic.jpg", null));
    }
}
