package com.streamsql.logical;

import java.time.Duration;
import java.util.Objects;

/**
 * Hopping window specification.
 *
 * @param size the window size
 * @param advance the hop interval
 * @param grace the grace period, or null
 */
public record HoppingWindow(Duration size, Duration advance, Duration grace) {

    public HoppingWindow {
        Objects.requireNonNull(size, "size must not be null");
        Objects.requireNonNull(advance, "advance must not be null");
        if (size.isNegative() || size.isZero()) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (advance.isNegative() || advance.isZero()) {
            throw new IllegalArgumentException("advance must be positive");
        }
        if (grace != null && grace.isNegative()) {
            throw new IllegalArgumentException("grace must not be negative");
        }
    }

    public static HoppingWindow of(Duration size, Duration advance) {
        return new HoppingWindow(size, advance, null);
    }

    public boolean hasGrace() {
        return grace != null;
    }
}
