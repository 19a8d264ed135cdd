package io.timelapse4j.core;

import java.time.Instant;
import java.util.Optional;

/**
 * A concrete recurrence rule produced from a {@link Schedule}.
 */
public interface CompiledTrigger {

    /**
     * First fire time for a job registered (or resumed) at {@code registeredAt}.
     */
    Instant firstFire(Instant registeredAt);

    /**
     * Next fire time after a fire that was scheduled for {@code scheduled} and claimed at {@code now}.
     * Fires missed while the process was busy are coalesced: the result is always after {@code now}.
     */
    Instant nextFire(Instant scheduled, Instant now);

    /**
     * Window that must contain the fire time of day, checked when the job fires.
     */
    default Optional<TimeWindow> gateWindow() {
        return Optional.empty();
    }

    String describe();
}
