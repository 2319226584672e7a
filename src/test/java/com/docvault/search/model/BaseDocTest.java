package com.docvault.search.model;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class BaseDocTest {

    @Test
    public void firstTouchSetsBothTimestampsEqual() {
        ArticleDoc doc = new ArticleDoc();
        doc.touch(OffsetDateTime.parse("2026-03-01T10:00:00.123456Z"));

        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:00.123Z"), doc.getCreated_at());
        assertEquals(doc.getCreated_at(), doc.getUpdated_at());
    }

    @Test
    public void laterTouchKeepsCreatedAt() {
        UserDoc doc = new UserDoc();
        doc.touch(OffsetDateTime.parse("2026-03-01T10:00:00Z"));
        doc.touch(OffsetDateTime.parse("2026-03-01T11:00:00Z"));

        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:00Z"), doc.getCreated_at());
        assertEquals(OffsetDateTime.parse("2026-03-01T11:00:00Z"), doc.getUpdated_at());
    }

    @Test
    public void clockGoingBackwardsStillMovesUpdatedAtForward() {
        ArticleDoc doc = new ArticleDoc();
        doc.touch(OffsetDateTime.parse("2026-03-01T10:00:00Z"));
        doc.touch(OffsetDateTime.parse("2026-03-01T09:00:00Z"));

        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:00.001Z"), doc.getUpdated_at());
        assertFalse(doc.getUpdated_at().isBefore(doc.getCreated_at()));
    }

    @Test
    public void timestampsAreNormalizedToUtc() {
        ArticleDoc doc = new ArticleDoc();
        doc.touch(OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)));

        assertEquals(ZoneOffset.UTC, doc.getCreated_at().getOffset());
        assertEquals(10, doc.getCreated_at().getHour());
    }
}
