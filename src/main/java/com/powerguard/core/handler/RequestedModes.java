package com.powerguard.core.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Maps free-text requested modes onto a handler's closed mode enum.
 */
public final class RequestedModes {

    private static final Logger log = LoggerFactory.getLogger(RequestedModes.class);

    private RequestedModes() {}

    /**
     * Looks {@code raw} up in {@code aliases} after trimming, lower-casing and turning
     * {@code -} and spaces into {@code _}. Absent or unknown text yields {@code fallback}.
     */
    public static <E extends Enum<E>> Resolved<E> resolve(String raw, Map<String, E> aliases, E fallback) {
        if (raw == null || raw.isBlank()) {
            return new Resolved<>(fallback, null);
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        E mode = aliases.get(normalized);
        if (mode == null) {
            log.warn("Unrecognized mode '{}', using default {}", raw, fallback);
            return new Resolved<>(fallback, raw);
        }
        return new Resolved<>(mode, null);
    }

    /**
     * @param mode         the mode to apply
     * @param unrecognized the raw text when it was not understood, otherwise {@code null}
     */
    public record Resolved<E extends Enum<E>>(E mode, String unrecognized) {

        public boolean defaulted() {
            return unrecognized != null;
        }

        /** Suffix for result details, empty unless the default was substituted for unknown text. */
        public String note() {
            return defaulted()
                    ? " (unrecognized mode '%s', defaulted to %s)".formatted(unrecognized, mode.name().toLowerCase(Locale.ROOT))
                    : "";
        }
    }
}
