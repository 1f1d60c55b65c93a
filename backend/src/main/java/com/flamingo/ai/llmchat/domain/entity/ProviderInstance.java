package com.flamingo.ai.llmchat.domain.entity;

import com.flamingo.ai.llmchat.domain.enums.ProviderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A configured LLM provider endpoint with its credentials. */
@Entity
@Table(name = "provider_instances")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProviderInstance {

  @Id private String id;

  @Column(nullable = false)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ProviderType type;

  @Column(nullable = false)
  private String baseUrl;

  private String apiKey;

  @Builder.Default private boolean enabled = true;

  private LocalDateTime lastUsedAt;

  private String lastModelId;

  private LocalDateTime modelsCachedAt;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
