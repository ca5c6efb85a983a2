package com.ryuqq.viewstore.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @Test
    void defaults() {
        StoreConfig config = new StoreConfig();

        assertEquals("id", config.idProperty());
        assertTrue(config.generateIds());
        assertTrue(config.copyOnRead());
    }

    @Test
    void withers_ChangeOneSettingOnly() {
        StoreConfig config = new StoreConfig().withIdProperty("key").withCopyOnRead(false);

        assertEquals("key", config.idProperty());
        assertTrue(config.generateIds());
        assertFalse(config.copyOnRead());
        assertFalse(config.withGenerateIds(false).generateIds());
    }

    @Test
    void blankIdProperty_Throws() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new StoreConfig(" ", true, true)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }
}
