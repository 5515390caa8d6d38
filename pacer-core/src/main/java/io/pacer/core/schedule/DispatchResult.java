package io.pacer.core.schedule;

import java.util.UUID;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface DispatchResult
{
    /**
     * The entry after the attempt: advanced on success, unchanged on failure.
     */
    ScheduleEntry getEntry();

    boolean isSuccess();

    UUID getCorrelationId();

    Optional<String> getError();

    static DispatchResult success(ScheduleEntry updated, UUID correlationId)
    {
        return ImmutableDispatchResult.builder()
            .entry(updated)
            .isSuccess(true)
            .correlationId(correlationId)
            .build();
    }

    static DispatchResult failure(ScheduleEntry unchanged, UUID correlationId, String error)
    {
        return ImmutableDispatchResult.builder()
            .entry(unchanged)
            .isSuccess(false)
            .correlationId(correlationId)
            .error(error)
            .build();
    }
}
