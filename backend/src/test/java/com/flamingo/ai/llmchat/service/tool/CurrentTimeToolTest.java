package com.flamingo.ai.llmchat.service.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class CurrentTimeToolTest {

  private final CurrentTimeTool tool =
      new CurrentTimeTool(Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
  private final ToolContext context =
      new ToolContext("c1", "p1", "m1", CancellationToken.create());

  @Test
  void shouldReturnTimeInClockZone() {
    StepVerifier.create(tool.execute(Map.of(), context))
        .assertNext(
            result -> {
              assertThat(result.success()).isTrue();
              assertThat(result.content()).isEqualTo("2024-05-01T12:00:00Z");
            })
        .verifyComplete();
  }

  @Test
  void shouldConvertToRequestedZone() {
    StepVerifier.create(tool.execute(Map.of("timezone", "Asia/Tokyo"), context))
        .assertNext(result -> assertThat(result.content()).startsWith("2024-05-01T21:00:00+09:00"))
        .verifyComplete();
  }

  @Test
  void shouldFailForUnknownZone() {
    StepVerifier.create(tool.execute(Map.of("timezone", "Mars/Olympus"), context))
        .assertNext(
            result -> {
              assertThat(result.success()).isFalse();
              assertThat(result.error()).isEqualTo("Unknown time zone: Mars/Olympus");
            })
        .verifyComplete();
  }
}
