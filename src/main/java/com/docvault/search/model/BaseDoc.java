package com.docvault.search.model;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Common part of every indexed document. The id is the backend-assigned document id and is
 * never stored inside the document source.
 */
public abstract class BaseDoc {
    private String id;
    private OffsetDateTime created_at;
    private OffsetDateTime updated_at;

    /**
     * Stamps the document before it is written: created_at once, updated_at on every save.
     * updated_at never goes backwards and never repeats, even if the clock does.
     */
    public void touch(OffsetDateTime now) {
        OffsetDateTime ts = now.withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        if (created_at == null) {
            created_at = ts;
        }
        if (updated_at != null && !ts.isAfter(updated_at)) {
            ts = updated_at.plus(1, ChronoUnit.MILLIS);
        }
        updated_at = ts;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public OffsetDateTime getCreated_at() {
        return created_at;
    }

    public void setCreated_at(OffsetDateTime created_at) {
        this.created_at = created_at;
    }

    public OffsetDateTime getUpdated_at() {
        return updated_at;
    }

    public void setUpdated_at(OffsetDateTime updated_at) {
        this.updated_at = updated_at;
    }
}
