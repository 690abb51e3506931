package com.parley.core.protocol;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates ids of the form {@code <prefix>-<epochMillis>-<random>}.
 *
 * <p>Ids sort roughly by creation time; uniqueness comes from the random suffix.
 */
public final class RequestIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private RequestIds() {}

    public static String next(String prefix, Clock clock) {
        return next(prefix, clock, 6);
    }

    public static String next(String prefix, Clock clock, int suffixLength) {
        var random = ThreadLocalRandom.current();
        var sb = new StringBuilder(prefix).append('-').append(clock.millis()).append('-');
        for (int i = 0; i < suffixLength; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
