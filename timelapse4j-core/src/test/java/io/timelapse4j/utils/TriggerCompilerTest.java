package io.timelapse4j.utils;

import io.timelapse4j.core.CompiledTrigger;
import io.timelapse4j.core.CronTrigger;
import io.timelapse4j.core.Frequency;
import io.timelapse4j.core.PeriodTrigger;
import io.timelapse4j.core.Schedule;
import io.timelapse4j.core.ScheduleCompileException;
import io.timelapse4j.core.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TriggerCompilerTest {

    private final TriggerCompiler compiler = new TriggerCompiler(ZoneOffset.UTC);

    @Test
    void perDayShouldSpreadEvenlyWithInclusiveEndpoints() {
        List<LocalTime> times = TriggerCompiler.distributedTimes(5, TimeWindow.of("06:00", "20:00"));

        assertEquals(List.of(
                LocalTime.of(6, 0),
                LocalTime.of(9, 30),
                LocalTime.of(13, 0),
                LocalTime.of(16, 30),
                LocalTime.of(20, 0)
        ), times);
    }

    @Test
    void perDayShouldFloorUnevenSpacing() {
        List<LocalTime> times = TriggerCompiler.distributedTimes(8, TimeWindow.of("07:00", "08:00"));

        assertEquals(8, times.size());
        assertEquals(LocalTime.of(7, 0), times.get(0));
        assertEquals(LocalTime.of(8, 0), times.get(7));
        for (int i = 1; i < times.size(); i++) {
            assertTrue(times.get(i).isAfter(times.get(i - 1)), "times must be strictly increasing");
            long gap = Duration.between(times.get(i - 1), times.get(i)).toMinutes();
            assertTrue(gap == 8 || gap == 9, "gap should be 60/7 minutes after flooring, was " + gap);
        }
        assertEquals(LocalTime.of(7, 8), times.get(1));
        assertEquals(LocalTime.of(7, 51), times.get(6));
    }

    @Test
    void singlePerDayShouldLandOnWindowMidpoint() {
        assertEquals(List.of(LocalTime.of(14, 0)),
                TriggerCompiler.distributedTimes(1, TimeWindow.of("08:00", "20:00")));
    }

    @Test
    void perDayShouldSpanMidnightForWrappingWindow() {
        List<LocalTime> times = TriggerCompiler.distributedTimes(3, TimeWindow.of("22:00", "04:00"));

        assertEquals(List.of(LocalTime.of(22, 0), LocalTime.of(1, 0), LocalTime.of(4, 0)), times);
    }

    @Test
    void perDayWithoutWindowShouldCoverWholeDay() {
        assertEquals(List.of(LocalTime.of(0, 0), LocalTime.of(23, 59)),
                TriggerCompiler.distributedTimes(2, null));
        assertEquals(List.of(LocalTime.of(11, 59)),
                TriggerCompiler.distributedTimes(1, null));
    }

    @Test
    void perDayShouldCollapseTimesOnTheSameMinute() {
        List<LocalTime> times = TriggerCompiler.distributedTimes(5, TimeWindow.of("10:00", "10:02"));

        assertEquals(List.of(LocalTime.of(10, 0), LocalTime.of(10, 1), LocalTime.of(10, 2)), times);
    }

    @Test
    void nonPositivePerDayCountShouldYieldNoTriggers() {
        assertTrue(compiler.compile(Schedule.perDay("none", 0, null)).isEmpty());
        assertTrue(compiler.compile(Schedule.perDay("negative", -3, TimeWindow.of("08:00", "09:00"))).isEmpty());
    }

    @Test
    void perDayShouldCompileToDailyCronTriggers() {
        List<CompiledTrigger> triggers = compiler.compile(Schedule.perDay("noon", 1, TimeWindow.of("08:00", "20:00")));

        assertEquals(1, triggers.size());
        CronTrigger cron = assertInstanceOf(CronTrigger.class, triggers.get(0));
        assertEquals("0 0 14 * * ?", cron.cronExpression());
        assertEquals(Instant.parse("2026-01-01T14:00:00Z"), cron.firstFire(Instant.parse("2026-01-01T09:00:00Z")));
    }

    @Test
    void zeroSpanWindowShouldBeRejectedForSeveralPerDay() {
        Schedule schedule = Schedule.perDay("broken", 3, TimeWindow.of("10:00", "10:00"));

        ScheduleCompileException ex = assertThrows(ScheduleCompileException.class, () -> compiler.compile(schedule));
        assertEquals("broken", ex.getScheduleName());
    }

    @Test
    void hourlyWithoutWindowShouldFireEveryHour() {
        CronTrigger cron = (CronTrigger) compiler.compile(Schedule.hourly("all-day", null)).get(0);

        assertEquals("0 0 * * * ?", cron.cronExpression());
        assertEquals(Instant.parse("2026-01-01T06:00:00Z"), cron.firstFire(Instant.parse("2026-01-01T05:12:00Z")));
    }

    @Test
    void hourlyShouldRestrictToWindowHours() {
        CronTrigger day = (CronTrigger) compiler.compile(Schedule.hourly("day", TimeWindow.of("06:00", "20:00"))).get(0);
        CronTrigger night = (CronTrigger) compiler.compile(Schedule.hourly("night", TimeWindow.of("22:00", "04:00"))).get(0);

        assertEquals("0 0 6-20 * * ?", day.cronExpression());
        assertEquals("0 0 22-23,0-4 * * ?", night.cronExpression());
    }

    @Test
    void hourlyWrappingWindowShouldFireAcrossMidnight() {
        CronTrigger night = (CronTrigger) compiler.compile(Schedule.hourly("night", TimeWindow.of("22:00", "04:00"))).get(0);

        assertEquals(Instant.parse("2026-01-01T22:00:00Z"), night.firstFire(Instant.parse("2026-01-01T05:30:00Z")));
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), night.firstFire(Instant.parse("2026-01-01T23:10:00Z")));
        assertEquals(Instant.parse("2026-01-02T04:00:00Z"), night.firstFire(Instant.parse("2026-01-02T03:59:00Z")));
        assertEquals(Instant.parse("2026-01-02T22:00:00Z"), night.firstFire(Instant.parse("2026-01-02T04:00:00Z")));
    }

    @Test
    void hourRangeShouldHandleWindowsInsideOneHour() {
        assertEquals("8", TriggerCompiler.hourRange(TimeWindow.of("08:10", "08:50")));
        assertEquals("*", TriggerCompiler.hourRange(TimeWindow.of("08:50", "08:10")));
    }

    @Test
    void intervalShouldCarryWindowAsGate() {
        TimeWindow window = TimeWindow.of("06:00", "18:00");
        CompiledTrigger trigger = compiler.compile(Schedule.interval("every-3h", 3, window)).get(0);

        PeriodTrigger period = assertInstanceOf(PeriodTrigger.class, trigger);
        assertEquals(Duration.ofHours(3), period.period());
        assertEquals(window, period.gateWindow().orElseThrow());
    }

    @Test
    void nonPositiveIntervalShouldBeRejected() {
        assertThrows(ScheduleCompileException.class,
                () -> compiler.compile(Schedule.interval("zero", 0, null)));
    }

    @Test
    void unknownFrequencyShouldBeRejected() {
        Schedule schedule = new Schedule("mystery", null, true, 1, null);

        assertThrows(ScheduleCompileException.class, () -> compiler.compile(schedule));
    }

    @Test
    void frequencyTagsShouldResolve() {
        assertEquals(Frequency.X_PER_DAY, Frequency.fromTag("x_per_day"));
        assertEquals(Frequency.HOURLY, Frequency.fromTag(" Hourly "));
        assertEquals(null, Frequency.fromTag("weekly"));
    }
}
