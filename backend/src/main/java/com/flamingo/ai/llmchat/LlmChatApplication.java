package com.flamingo.ai.llmchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Main application class for the LLM chat backend. */
@SpringBootApplication
public class LlmChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(LlmChatApplication.class, args);
  }
}
