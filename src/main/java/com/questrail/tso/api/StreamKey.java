package com.questrail.tso.api;

import java.util.Objects;

/**
 * Identifies an independent timestamp stream: the single global stream, or the
 * stream of one region (datacenter / zone).
 */
public record StreamKey(String region)
{
    /**
     * Reserved stream id of the global stream.
     */
    public static final String GLOBAL_ID = "global";

    public static final StreamKey GLOBAL = new StreamKey(null);

    public StreamKey {
        if (region != null && (region.isBlank() || region.equals(GLOBAL_ID))) {
            throw new IllegalArgumentException("Invalid region: '" + region + "'");
        }
    }

    public static StreamKey region(String region) {
        return new StreamKey(Objects.requireNonNull(region, "region"));
    }

    /**
     * Parses a wire or configuration key; {@code null}, empty and
     * {@value #GLOBAL_ID} denote the global stream.
     */
    public static StreamKey parse(String key) {
        if (key == null || key.isEmpty() || key.equals(GLOBAL_ID)) {
            return GLOBAL;
        }
        return region(key);
    }

    public boolean isGlobal() {
        return region == null;
    }

    /**
     * Identifier under which this stream's checkpoint is persisted.
     */
    public String streamId() {
        return isGlobal() ? GLOBAL_ID : "region/" + region;
    }

    @Override
    public String toString() {
        return isGlobal() ? GLOBAL_ID : region;
    }
}
