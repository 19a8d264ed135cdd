package io.timelapse4j.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggersTest {

    private static final Instant T = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void cronNextFireShouldCoalesceMissedFires() {
        CronTrigger trigger = new CronTrigger("0 30 9 * * ?", ZoneOffset.UTC);

        Instant first = trigger.firstFire(T);
        assertEquals(Instant.parse("2026-03-02T09:30:00Z"), first);
        assertEquals(Instant.parse("2026-03-03T09:30:00Z"), trigger.nextFire(first, first));
        assertEquals(Instant.parse("2026-03-06T09:30:00Z"),
                trigger.nextFire(first, Instant.parse("2026-03-05T12:00:00Z")));
    }

    @Test
    void cronShouldEvaluateInItsZone() {
        CronTrigger trigger = new CronTrigger("0 0 8 * * ?", ZoneId.of("Asia/Taipei"));

        assertEquals(Instant.parse("2026-03-02T00:00:00Z"), trigger.firstFire(T));
    }

    @Test
    void invalidCronShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CronTrigger("every day", ZoneOffset.UTC));
    }

    @Test
    void periodShouldKeepPhaseAndSkipMissedFires() {
        PeriodTrigger trigger = new PeriodTrigger(Duration.ofHours(2), null);

        assertEquals(T.plus(Duration.ofHours(2)), trigger.firstFire(T));
        assertEquals(T.plus(Duration.ofHours(4)),
                trigger.nextFire(T.plus(Duration.ofHours(2)), T.plus(Duration.ofHours(2)).plusSeconds(1)));
        assertEquals(T.plus(Duration.ofHours(8)),
                trigger.nextFire(T, T.plus(Duration.ofMinutes(450))));
        assertEquals(T.plus(Duration.ofHours(10)),
                trigger.nextFire(T, T.plus(Duration.ofHours(8))));
        assertTrue(trigger.gateWindow().isEmpty());
    }

    @Test
    void nonPositivePeriodShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PeriodTrigger(Duration.ZERO, null));
    }

    @Test
    void policyBackoffShouldDoubleFromBaseDelay() {
        CapturePolicy policy = CapturePolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.backoffAfter(0));
        assertEquals(Duration.ofSeconds(2), policy.backoffAfter(1));
        assertEquals(Duration.ofSeconds(4), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(500), policy.withRetries(3, 0.5).backoffAfter(0));
        assertEquals(Duration.ofSeconds(33), policy.worstCaseDuration());
    }

    @Test
    void camerasShouldCompareStructurally() {
        Camera a = new Camera("gate", "rtsp://cam/gate", true,
                java.util.List.of(Schedule.hourly("day", TimeWindow.of("06:00", "20:00"))), CapturePolicy.defaults());
        Camera b = new Camera("gate", "rtsp://cam/gate", true,
                java.util.List.of(Schedule.hourly("day", TimeWindow.of("06:00", "20:00"))), null);

        assertEquals(a, b);
        assertTrue(!a.equals(b.withPolicy(CapturePolicy.defaults().withRetries(5, 1.0))));
    }
}
