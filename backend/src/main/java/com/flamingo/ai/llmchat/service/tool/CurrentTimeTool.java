package com.flamingo.ai.llmchat.service.tool;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Built-in tool returning the current date and time, optionally in a given time zone. */
@Component
@RequiredArgsConstructor
public class CurrentTimeTool implements Tool {

  static final String NAME = "get_current_time";

  private final Clock clock;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Returns the current date and time in ISO-8601 format.";
  }

  @Override
  public Map<String, Object> parameters() {
    return Map.of(
        "type",
        "object",
        "properties",
        Map.of(
            "timezone",
            Map.of("type", "string", "description", "IANA time zone, e.g. Europe/Berlin")));
  }

  @Override
  public Mono<ToolResult> execute(Map<String, Object> arguments, ToolContext context) {
    Object requested = arguments.get("timezone");
    ZoneId zone;
    try {
      zone = requested != null ? ZoneId.of(requested.toString()) : clock.getZone();
    } catch (DateTimeException e) {
      return Mono.just(ToolResult.failure("Unknown time zone: " + requested));
    }
    String now = ZonedDateTime.now(clock.withZone(zone)).format(DateTimeFormatter.ISO_ZONED_DATE_TIME);
    return Mono.just(ToolResult.success(now));
  }
}
