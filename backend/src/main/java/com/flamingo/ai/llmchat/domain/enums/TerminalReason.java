package com.flamingo.ai.llmchat.domain.enums;

/** Why the last generation of a session ended. Absent while running or after a manual stop. */
public enum TerminalReason {
  /** The model finished normally. */
  STOP,

  /** The generation failed after classification and any retries. */
  ERROR
}
