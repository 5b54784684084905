package com.weather.gateway.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Three-way result of a cache read: fresh entry, expired (stale) entry, or nothing stored.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CacheLookup {

    public enum Status {
        FRESH,
        STALE,
        ABSENT
    }

    private static final CacheLookup ABSENT = new CacheLookup(Status.ABSENT, null);

    private final Status status;
    private final CacheEntry entry;

    public static CacheLookup fresh(CacheEntry entry) {
        return new CacheLookup(Status.FRESH, entry);
    }

    public static CacheLookup stale(CacheEntry entry) {
        return new CacheLookup(Status.STALE, entry);
    }

    public static CacheLookup absent() {
        return ABSENT;
    }

    public boolean isFresh() {
        return status == Status.FRESH;
    }

    public boolean isStale() {
        return status == Status.STALE;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }
}
