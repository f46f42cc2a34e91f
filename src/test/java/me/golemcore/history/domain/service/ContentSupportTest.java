package me.golemcore.history.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentSupportTest {

    @Test
    void truncate_appendsEllipsisOnlyWhenCut() {
        assertEquals("hello", ContentSupport.truncate("hello", 5));
        assertEquals("hel...", ContentSupport.truncate("hello", 3));
        assertEquals("", ContentSupport.truncate(null, 3));
    }

    @Test
    void cap_cutsWithoutMarker() {
        assertEquals("hel", ContentSupport.cap("hello", 3));
        assertEquals("hello", ContentSupport.cap("hello", 10));
    }}
