package io.pacer.spi;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import com.fasterxml.jackson.databind.JsonNode;
import io.pacer.commons.config.Config;
import org.immutables.value.Value;

@Value.Immutable
public interface JobRequest
{
    String getTaskIdentifier();

    List<JsonNode> getArgs();

    Config getKwargs();

    UUID getCorrelationId();

    String getScheduleName();

    Instant getScheduledAt();

    static ImmutableJobRequest.Builder builder()
    {
        return ImmutableJobRequest.builder();
    }
}
