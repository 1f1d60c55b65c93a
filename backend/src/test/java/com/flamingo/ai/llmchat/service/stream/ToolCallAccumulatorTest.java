package com.flamingo.ai.llmchat.service.stream;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ToolCallAccumulatorTest {

  private final ToolCallAccumulator accumulator = new ToolCallAccumulator();

  private void accept(int index, String id, String name, String args) {
    accumulator.accept(new ChatStreamEvent.ToolCallFragment(index, id, name, args));
  }

  @Test
  @DisplayName("Should concatenate argument fragments per index")
  void shouldConcatenateArguments() {
    accept(0, "call_1", "get_current_time", "{\"time");
    accept(0, null, null, "zone\":\"UTC\"}");

    assertThat(accumulator.build())
        .containsExactly(new ToolCall("call_1", "get_current_time", "{\"timezone\":\"UTC\"}"));
  }

  @Test
  @DisplayName("Should order calls by index regardless of arrival")
  void shouldOrderByIndex() {
    accept(1, "call_b", "second", "{}");
    accept(0, "call_a", "first", "{}");

    List<ToolCall> calls = accumulator.build();

    assertThat(calls).extracting(ToolCall::name).containsExactly("first", "second");
  }

  @Test
  @DisplayName("Should drop slots that never received a function name")
  void shouldDropNamelessSlots() {
    accept(0, "call_a", null, "{}");
    accept(1, "call_b", "named", "{}");

    assertThat(accumulator.build()).extracting(ToolCall::id).containsExactly("call_b");
  }

  @Test
  @DisplayName("Should generate an id when the provider sends none")
  void shouldGenerateMissingId() {
    accept(0, null, "lookup", "{}");

    assertThat(accumulator.build().get(0).id()).startsWith("call_").hasSize(13);
  }

  @Test
  void shouldResetToEmpty() {
    accept(0, "call_a", "first", "{}");
    accumulator.reset();

    assertThat(accumulator.isEmpty()).isTrue();
    assertThat(accumulator.build()).isEmpty();
  }
}
