package com.questrail.tso.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognised option names and value parsers for {@link TsoConfig#fromOptions(Map)}.
 *
 * <p>Durations use Go-style notation: one or more {@code <number><unit>}
 * segments, units {@code ns}, {@code us} (or {@code µs}), {@code ms}, {@code s},
 * {@code m}, {@code h}. Examples: {@code 50ms}, {@code 1m30s}, {@code 0.5s}.</p>
 */
public final class TsoOptions {

    public static final String UPDATE_PHYSICAL_INTERVAL = "tso-update-physical-interval";
    public static final String SAVE_INTERVAL = "tso-save-interval";
    public static final String MAX_GAP_RESET_TS = "max-gap-reset-ts";
    public static final String PERSIST_AHEAD_MARGIN = "tso-persist-ahead-margin";
    public static final String SAVE_SAFETY_MARGIN = "tso-save-safety-margin";
    public static final String STORE_RETRY_ATTEMPTS = "tso-store-retry-attempts";
    public static final String STORE_RETRY_BACKOFF = "tso-store-retry-backoff";
    public static final String MAX_ALLOCATE_COUNT = "tso-max-allocate-count";
    public static final String ALLOCATE_RETRY_ATTEMPTS = "tso-allocate-retry-attempts";
    public static final String ENABLE_LOCAL_TSO = "enable-local-tso";
    public static final String LOCAL_TSO_REGIONS = "local-tso-regions";
    public static final String BACKEND_ENDPOINTS = "backend-endpoints";
    public static final String LISTEN_ADDR = "listen-addr";

    static final Set<String> ALL = Set.of(
            UPDATE_PHYSICAL_INTERVAL, SAVE_INTERVAL, MAX_GAP_RESET_TS,
            PERSIST_AHEAD_MARGIN, SAVE_SAFETY_MARGIN,
            STORE_RETRY_ATTEMPTS, STORE_RETRY_BACKOFF,
            MAX_ALLOCATE_COUNT, ALLOCATE_RETRY_ATTEMPTS,
            ENABLE_LOCAL_TSO, LOCAL_TSO_REGIONS,
            BACKEND_ENDPOINTS, LISTEN_ADDR);

    private static final Pattern DURATION_SEGMENT =
            Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

    private TsoOptions() {}

    /**
     * Parses a Go-style duration string.
     *
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parseDuration(String text) {
        String s = text.trim();
        if (s.equals("0")) {
            return Duration.ZERO;
        }
        Matcher m = DURATION_SEGMENT.matcher(s);
        long nanos = 0;
        int pos = 0;
        while (pos < s.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("Invalid duration: '" + text + "'");
            }
            double value = Double.parseDouble(m.group(1));
            nanos += Math.round(value * unitNanos(m.group(2)));
            pos = m.end();
        }
        if (pos == 0) {
            throw new IllegalArgumentException("Invalid duration: '" + text + "'");
        }
        return Duration.ofNanos(nanos);
    }

    private static long unitNanos(String unit) {
        switch (unit) {
            case "ns": return 1L;
            case "us":
            case "µs": return 1_000L;
            case "ms": return 1_000_000L;
            case "s": return 1_000_000_000L;
            case "m": return 60_000_000_000L;
            case "h": return 3_600_000_000_000L;
            default: throw new IllegalArgumentException("Unknown unit: " + unit);
        }
    }

    static Optional<String> string(Map<String, String> options, String key) {
        return Optional.ofNullable(options.get(key)).map(String::trim);
    }

    static Optional<Duration> duration(Map<String, String> options, String key) {
        return string(options, key).map(v -> {
            try {
                return parseDuration(v);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(key + ": " + e.getMessage(), e);
            }
        });
    }

    static Optional<Integer> integer(Map<String, String> options, String key) {
        return string(options, key).map(v -> {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + ": not an integer: '" + v + "'", e);
            }
        });
    }

    static Optional<Boolean> bool(Map<String, String> options, String key) {
        return string(options, key).map(v -> {
            if (v.equalsIgnoreCase("true")) {
                return Boolean.TRUE;
            }
            if (v.equalsIgnoreCase("false")) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException(key + ": not a boolean: '" + v + "'");
        });
    }

    static Optional<List<String>> list(Map<String, String> options, String key) {
        return string(options, key).map(v -> Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList()));
    }
}
