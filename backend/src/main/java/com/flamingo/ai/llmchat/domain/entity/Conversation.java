package com.flamingo.ai.llmchat.domain.entity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A persisted conversation: title, model selection, usage aggregates and its messages. */
@Entity
@Table(name = "conversations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

  public static final String DEFAULT_TITLE = "New conversation";

  @Id private String id;

  @Column(nullable = false)
  private String title;

  private String providerInstanceId;

  private String modelId;

  @Column(columnDefinition = "TEXT")
  private String systemPrompt;

  @Builder.Default private long promptTokens = 0;

  @Builder.Default private long completionTokens = 0;

  @Builder.Default private double totalCost = 0.0;

  @OneToMany(mappedBy = "conversation", cascade = CascadeType.ALL, orphanRemoval = true)
  @Builder.Default
  private List<ChatMessage> messages = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Adds usage reported for one assistant message to the running totals. */
  public void addUsage(Integer prompt, Integer completion, Double cost) {
    promptTokens += prompt != null ? prompt : 0;
    completionTokens += completion != null ? completion : 0;
    totalCost += cost != null ? cost : 0.0;
  }
}
