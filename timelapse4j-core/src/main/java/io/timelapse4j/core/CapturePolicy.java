package io.timelapse4j.core;

import java.time.Duration;

/**
 * Per-camera capture settings.
 *
 * <p>{@code retryCount} is the total number of attempts per fire, and
 * {@code retryDelaySeconds} the base of the exponential backoff between them
 * (1s, 2s, 4s... for a base of one second). {@code resolutionScale} is null when
 * frames keep their original resolution.
 */
public record CapturePolicy(
        int jpegQuality,
        int timeoutSeconds,
        int retryCount,
        double retryDelaySeconds,
        Double resolutionScale
) {
    public static final int DEFAULT_JPEG_QUALITY = 90;
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final double DEFAULT_RETRY_DELAY_SECONDS = 1.0;

    public CapturePolicy {
        if (jpegQuality < 0 || jpegQuality > 100) {
            throw new IllegalArgumentException("jpegQuality must be within 0..100: " + jpegQuality);
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative: " + timeoutSeconds);
        }
        if (retryDelaySeconds < 0 || Double.isNaN(retryDelaySeconds)) {
            throw new IllegalArgumentException("retryDelaySeconds must not be negative: " + retryDelaySeconds);
        }
        if (resolutionScale != null && resolutionScale <= 0) {
            throw new IllegalArgumentException("resolutionScale must be positive: " + resolutionScale);
        }
    }

    public static CapturePolicy defaults() {
        return new CapturePolicy(
                DEFAULT_JPEG_QUALITY,
                DEFAULT_TIMEOUT_SECONDS,
                DEFAULT_RETRY_COUNT,
                DEFAULT_RETRY_DELAY_SECONDS,
                null
        );
    }

    public CapturePolicy withRetries(int retryCount, double retryDelaySeconds) {
        return new CapturePolicy(jpegQuality, timeoutSeconds, retryCount, retryDelaySeconds, resolutionScale);
    }

    /**
     * Backoff before the attempt following the failed attempt {@code attemptIndex} (zero based).
     */
    public Duration backoffAfter(int attemptIndex) {
        int exp = Math.max(0, Math.min(attemptIndex, 30));
        double seconds = retryDelaySeconds * (1L << exp);
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    /**
     * Upper bound of one capture fire: every attempt hitting its timeout plus all backoff delays.
     */
    public Duration worstCaseDuration() {
        int attempts = Math.max(1, retryCount);
        Duration total = Duration.ofSeconds((long) timeoutSeconds * attempts);
        for (int i = 0; i < attempts - 1; i++) {
            total = total.plus(backoffAfter(i));
        }
        return total;
    }
}
