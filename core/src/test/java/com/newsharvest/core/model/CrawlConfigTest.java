package com.newsharvest.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CrawlConfigTest {

    @Test
    void defaults_are_valid() {
        CrawlConfig cfg = CrawlConfig.defaults();
        assertDoesNotThrow(cfg::validate);
        assertEquals("https://www.nrinow.news/", cfg.getSiteOrigin());
        assertEquals(7, cfg.getNominalPerPage());
        assertEquals(15_000, cfg.getTimeoutMsInt());
    }

    @Test
    void origin_gets_trailing_slash() {
        assertEquals("https://example.org/", CrawlConfig.defaults().setSiteOrigin("https://example.org").getSiteOrigin());
    }

    @Test
    void invalid_values_fail_validate() {
        assertThrows(IllegalArgumentException.class, () -> CrawlConfig.defaults().setSiteOrigin("ftp://x/").validate());
        assertThrows(IllegalArgumentException.class, () -> CrawlConfig.defaults().setTimeout(Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> CrawlConfig.defaults().setNominalPerPage(0).validate());

        CrawlConfig cfg = CrawlConfig.defaults();
        cfg.getPacing().setArticleDelayMinMs(5000).setArticleDelayMaxMs(1000);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, cfg::validate);
        assertTrue(e.getMessage().contains("articleDelay"));
    }
}
