package com.contentorganizer.bot.model;

import java.time.Instant;

public final class Provenance {
    public final Instant forwardedDate;   // nullable
    public final String forwardedFrom;    // display string, nullable

    public Provenance(Instant forwardedDate, String forwardedFrom) {
        this.forwardedDate = forwardedDate;
        this.forwardedFrom = forwardedFrom;
    }
}
