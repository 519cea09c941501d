package com.questrail.tso.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * TsoConfig
 * =============================================================================
 * Operational configuration of the timestamp allocation engine.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>updatePhysicalInterval</b> ({@code tso-update-physical-interval}):
 *       period of the maintenance tick. At most {@code 1 << 18} timestamps can be
 *       issued per physical millisecond. Clamped to [1 ms, 10 s].</li>
 *   <li><b>saveInterval</b> ({@code tso-save-interval}): checkpoint cadence and
 *       the budget within which a failed checkpoint save must recover.</li>
 *   <li><b>maxResetTsGap</b> ({@code max-gap-reset-ts}): maximum time to wait for
 *       the wall clock to catch up with the persisted watermark; exceeding it is a
 *       clock anomaly.</li>
 *   <li><b>persistAheadMargin</b>: how far ahead of the cursor a new watermark is
 *       written. Defaults to {@code saveInterval}.</li>
 *   <li><b>saveSafetyMargin</b>: a new watermark is written once the cursor comes
 *       this close to the current one.</li>
 *   <li><b>storeRetryAttempts</b> / <b>storeRetryBackoff</b>: retry policy for
 *       transient checkpoint store failures.</li>
 *   <li><b>maxAllocateCount</b>: upper bound of {@code count} per allocation.</li>
 *   <li><b>allocateRetryAttempts</b>: short waits for the tick before an
 *       allocation at the logical ceiling bumps physical synthetically.</li>
 *   <li><b>enableLocalTso</b> / <b>localRegions</b>: per-region allocators.</li>
 *   <li><b>backendEndpoints</b> / <b>listenAddr</b>: transport wiring.</li>
 * </ul>
 */
public record TsoConfig(
        Duration updatePhysicalInterval,
        Duration saveInterval,
        Duration maxResetTsGap,
        Duration persistAheadMargin,
        Duration saveSafetyMargin,
        int storeRetryAttempts,
        Duration storeRetryBackoff,
        int maxAllocateCount,
        int allocateRetryAttempts,
        boolean enableLocalTso,
        Set<String> localRegions,
        String backendEndpoints,
        String listenAddr
) {
    public static final Duration MIN_UPDATE_PHYSICAL_INTERVAL = Duration.ofMillis(1);
    public static final Duration MAX_UPDATE_PHYSICAL_INTERVAL = Duration.ofSeconds(10);

    public static final Duration DEFAULT_UPDATE_PHYSICAL_INTERVAL = Duration.ofMillis(50);
    public static final Duration DEFAULT_SAVE_INTERVAL = Duration.ofSeconds(3);
    public static final Duration DEFAULT_MAX_RESET_TS_GAP = Duration.ofHours(24);
    public static final Duration DEFAULT_SAVE_SAFETY_MARGIN = Duration.ofMillis(1);
    public static final int DEFAULT_STORE_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_STORE_RETRY_BACKOFF = Duration.ofMillis(50);
    public static final int DEFAULT_MAX_ALLOCATE_COUNT = 10_000;
    public static final int DEFAULT_ALLOCATE_RETRY_ATTEMPTS = 3;

    /**
     * Canonical constructor with validation. The update interval is clamped, not
     * rejected.
     */
    public TsoConfig {
        Objects.requireNonNull(updatePhysicalInterval, "updatePhysicalInterval");
        Objects.requireNonNull(saveInterval, "saveInterval");
        Objects.requireNonNull(maxResetTsGap, "maxResetTsGap");
        Objects.requireNonNull(persistAheadMargin, "persistAheadMargin");
        Objects.requireNonNull(saveSafetyMargin, "saveSafetyMargin");
        Objects.requireNonNull(storeRetryBackoff, "storeRetryBackoff");

        updatePhysicalInterval = clampUpdatePhysicalInterval(updatePhysicalInterval);

        requirePositive(saveInterval, "saveInterval");
        requirePositive(maxResetTsGap, "maxResetTsGap");
        requirePositive(persistAheadMargin, "persistAheadMargin");
        if (saveSafetyMargin.isNegative()) {
            throw new IllegalArgumentException("saveSafetyMargin must be non-negative");
        }
        if (saveSafetyMargin.compareTo(persistAheadMargin) >= 0) {
            throw new IllegalArgumentException("saveSafetyMargin must be smaller than persistAheadMargin");
        }
        if (storeRetryBackoff.isNegative()) {
            throw new IllegalArgumentException("storeRetryBackoff must be non-negative");
        }
        if (storeRetryAttempts < 1) {
            throw new IllegalArgumentException("storeRetryAttempts must be >= 1");
        }
        if (maxAllocateCount < 1 || maxAllocateCount > (1 << 18)) {
            throw new IllegalArgumentException("maxAllocateCount must be in [1, 262144]");
        }
        if (allocateRetryAttempts < 0) {
            throw new IllegalArgumentException("allocateRetryAttempts must be >= 0");
        }

        localRegions = localRegions == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(localRegions));
        if (!enableLocalTso && !localRegions.isEmpty()) {
            throw new IllegalArgumentException("localRegions require enableLocalTso");
        }
        backendEndpoints = backendEndpoints == null ? "" : backendEndpoints;
        listenAddr = listenAddr == null ? "" : listenAddr;
    }

    /**
     * Clamps an update interval into [{@link #MIN_UPDATE_PHYSICAL_INTERVAL},
     * {@link #MAX_UPDATE_PHYSICAL_INTERVAL}].
     */
    public static Duration clampUpdatePhysicalInterval(Duration interval) {
        if (interval.compareTo(MIN_UPDATE_PHYSICAL_INTERVAL) < 0) {
            return MIN_UPDATE_PHYSICAL_INTERVAL;
        }
        if (interval.compareTo(MAX_UPDATE_PHYSICAL_INTERVAL) > 0) {
            return MAX_UPDATE_PHYSICAL_INTERVAL;
        }
        return interval;
    }

    public static TsoConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a configuration from named options (the keys of {@link TsoOptions}).
     * Absent options keep their defaults.
     *
     * @throws IllegalArgumentException on unknown keys or malformed values
     */
    public static TsoConfig fromOptions(Map<String, String> options) {
        Objects.requireNonNull(options, "options");

        List<String> unknown = new ArrayList<>();
        for (String key : options.keySet()) {
            if (!TsoOptions.ALL.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown options: " + unknown);
        }

        Builder b = builder();
        TsoOptions.duration(options, TsoOptions.UPDATE_PHYSICAL_INTERVAL).ifPresent(b::withUpdatePhysicalInterval);
        TsoOptions.duration(options, TsoOptions.SAVE_INTERVAL).ifPresent(b::withSaveInterval);
        TsoOptions.duration(options, TsoOptions.MAX_GAP_RESET_TS).ifPresent(b::withMaxResetTsGap);
        TsoOptions.duration(options, TsoOptions.PERSIST_AHEAD_MARGIN).ifPresent(b::withPersistAheadMargin);
        TsoOptions.duration(options, TsoOptions.SAVE_SAFETY_MARGIN).ifPresent(b::withSaveSafetyMargin);
        TsoOptions.integer(options, TsoOptions.STORE_RETRY_ATTEMPTS).ifPresent(b::withStoreRetryAttempts);
        TsoOptions.duration(options, TsoOptions.STORE_RETRY_BACKOFF).ifPresent(b::withStoreRetryBackoff);
        TsoOptions.integer(options, TsoOptions.MAX_ALLOCATE_COUNT).ifPresent(b::withMaxAllocateCount);
        TsoOptions.integer(options, TsoOptions.ALLOCATE_RETRY_ATTEMPTS).ifPresent(b::withAllocateRetryAttempts);
        TsoOptions.bool(options, TsoOptions.ENABLE_LOCAL_TSO).ifPresent(b::withEnableLocalTso);
        TsoOptions.list(options, TsoOptions.LOCAL_TSO_REGIONS).ifPresent(b::withLocalRegions);
        TsoOptions.string(options, TsoOptions.BACKEND_ENDPOINTS).ifPresent(b::withBackendEndpoints);
        TsoOptions.string(options, TsoOptions.LISTEN_ADDR).ifPresent(b::withListenAddr);
        return b.build();
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration updatePhysicalInterval = DEFAULT_UPDATE_PHYSICAL_INTERVAL;
        private Duration saveInterval = DEFAULT_SAVE_INTERVAL;
        private Duration maxResetTsGap = DEFAULT_MAX_RESET_TS_GAP;
        private Duration persistAheadMargin;
        private Duration saveSafetyMargin = DEFAULT_SAVE_SAFETY_MARGIN;
        private int storeRetryAttempts = DEFAULT_STORE_RETRY_ATTEMPTS;
        private Duration storeRetryBackoff = DEFAULT_STORE_RETRY_BACKOFF;
        private int maxAllocateCount = DEFAULT_MAX_ALLOCATE_COUNT;
        private int allocateRetryAttempts = DEFAULT_ALLOCATE_RETRY_ATTEMPTS;
        private boolean enableLocalTso;
        private final Set<String> localRegions = new LinkedHashSet<>();
        private String backendEndpoints = "";
        private String listenAddr = "";

        public Builder withUpdatePhysicalInterval(Duration interval) {
            this.updatePhysicalInterval = interval;
            return this;
        }

        public Builder withSaveInterval(Duration interval) {
            this.saveInterval = interval;
            return this;
        }

        public Builder withMaxResetTsGap(Duration gap) {
            this.maxResetTsGap = gap;
            return this;
        }

        /**
         * Unset means "same as the save interval".
         */
        public Builder withPersistAheadMargin(Duration margin) {
            this.persistAheadMargin = margin;
            return this;
        }

        public Builder withSaveSafetyMargin(Duration margin) {
            this.saveSafetyMargin = margin;
            return this;
        }

        public Builder withStoreRetryAttempts(int attempts) {
            this.storeRetryAttempts = attempts;
            return this;
        }

        public Builder withStoreRetryBackoff(Duration backoff) {
            this.storeRetryBackoff = backoff;
            return this;
        }

        public Builder withMaxAllocateCount(int max) {
            this.maxAllocateCount = max;
            return this;
        }

        public Builder withAllocateRetryAttempts(int attempts) {
            this.allocateRetryAttempts = attempts;
            return this;
        }

        public Builder withEnableLocalTso(boolean enabled) {
            this.enableLocalTso = enabled;
            return this;
        }

        public Builder withLocalRegions(Iterable<String> regions) {
            for (String region : regions) {
                addLocalRegion(region);
            }
            return this;
        }

        public Builder addLocalRegion(String region) {
            this.localRegions.add(Objects.requireNonNull(region, "region"));
            return this;
        }

        public Builder withBackendEndpoints(String endpoints) {
            this.backendEndpoints = endpoints;
            return this;
        }

        public Builder withListenAddr(String listenAddr) {
            this.listenAddr = listenAddr;
            return this;
        }

        public TsoConfig build() {
            return new TsoConfig(
                    updatePhysicalInterval,
                    saveInterval,
                    maxResetTsGap,
                    persistAheadMargin != null ? persistAheadMargin : saveInterval,
                    saveSafetyMargin,
                    storeRetryAttempts,
                    storeRetryBackoff,
                    maxAllocateCount,
                    allocateRetryAttempts,
                    enableLocalTso,
                    localRegions,
                    backendEndpoints,
                    listenAddr);
        }
    }
}
