package com.chargedesk.api.generator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Random;

/**
 * Seeded source of the generator's random details: dates in "days ago" windows
 * relative to a fixed reference instant, amounts and identifiers.
 */
class RandomDates {

    private final Random random;
    private final Instant now;

    RandomDates(long seed, Clock clock) {
        this.random = new Random(seed);
        this.now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    Instant now() {
        return now;
    }

    /**
     * Whole days before now, uniformly in {@code [newestDaysAgo, oldestDaysAgo]}.
     */
    Instant daysAgo(int oldestDaysAgo, int newestDaysAgo) {
        return now.minus(Duration.ofDays(between(newestDaysAgo, oldestDaysAgo)));
    }

    Instant daysAgo(DayWindow window) {
        return daysAgo(window.oldest(), window.newest());
    }

    int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    BigDecimal decimal(double min, double max) {
        double value = min + random.nextDouble() * (max - min);
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    boolean flip() {
        return random.nextBoolean();
    }

    <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    /**
     * Window of whole days before now; {@code oldest >= newest}.
     */
    record DayWindow(int oldest, int newest) {
        DayWindow {
            if (newest < 0 || oldest < newest) {
                throw new IllegalArgumentException("Invalid day window " + oldest + ".." + newest);
            }
        }
    }
}
