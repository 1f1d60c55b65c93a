package com.flamingo.ai.llmchat.service.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/** Reassembles streamed tool-call fragments into complete calls, keyed by fragment index. */
public class ToolCallAccumulator {

  private final Map<Integer, Slot> slots = new TreeMap<>();

  public void accept(ChatStreamEvent.ToolCallFragment fragment) {
    Slot slot = slots.computeIfAbsent(fragment.index(), i -> new Slot());
    if (fragment.callId() != null && !fragment.callId().isEmpty()) {
      slot.id = fragment.callId();
    }
    if (fragment.functionName() != null && !fragment.functionName().isEmpty()) {
      slot.name = fragment.functionName();
    }
    if (fragment.argumentsFragment() != null) {
      slot.arguments.append(fragment.argumentsFragment());
    }
  }

  public boolean isEmpty() {
    return slots.isEmpty();
  }

  public void reset() {
    slots.clear();
  }

  /**
   * Returns the completed calls ordered by index. Slots without a function name are dropped;
   * missing call ids are generated.
   */
  public List<ToolCall> build() {
    List<ToolCall> calls = new ArrayList<>();
    for (Slot slot : slots.values()) {
      if (slot.name == null) {
        continue;
      }
      String id = slot.id != null ? slot.id : "call_" + UUID.randomUUID().toString().substring(0, 8);
      calls.add(new ToolCall(id, slot.name, slot.arguments.toString()));
    }
    return calls;
  }

  private static final class Slot {
    private String id;
    private String name;
    private final StringBuilder arguments = new StringBuilder();
  }
}
