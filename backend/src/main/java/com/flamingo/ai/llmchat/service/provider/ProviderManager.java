package com.flamingo.ai.llmchat.service.provider;

import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.domain.entity.ProviderInstance;
import com.flamingo.ai.llmchat.domain.repository.ProviderInstanceRepository;
import com.flamingo.ai.llmchat.exception.ProviderInstanceNotFoundException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns provider instances: their configuration, one cached client per instance, and a TTL cache
 * of each instance's model list. Saving or deleting an instance drops its cached client.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderManager {

  private final ProviderInstanceRepository providerInstanceRepository;
  private final ChatCompletionClientFactory clientFactory;
  private final ChatConfig chatConfig;
  private final Clock clock;

  private final Map<String, ChatCompletionClient> clients = new ConcurrentHashMap<>();
  private final Map<String, CachedModels> modelCache = new ConcurrentHashMap<>();

  @Transactional(readOnly = true)
  public List<ProviderInstance> getInstances() {
    return providerInstanceRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public ProviderInstance getInstance(String instanceId) {
    return providerInstanceRepository
        .findById(instanceId)
        .orElseThrow(() -> new ProviderInstanceNotFoundException(instanceId));
  }

  /** Creates or updates an instance; an id is assigned when missing. */
  @Transactional
  public ProviderInstance saveInstance(ProviderInstance instance) {
    if (instance.getId() == null || instance.getId().isBlank()) {
      instance.setId(UUID.randomUUID().toString());
    }
    ProviderInstance saved = providerInstanceRepository.save(instance);
    invalidate(saved.getId());
    log.info("Saved provider instance {} ({})", saved.getId(), saved.getName());
    return saved;
  }

  @Transactional
  public void deleteInstance(String instanceId) {
    if (!providerInstanceRepository.existsById(instanceId)) {
      throw new ProviderInstanceNotFoundException(instanceId);
    }
    providerInstanceRepository.deleteById(instanceId);
    invalidate(instanceId);
    log.info("Deleted provider instance {}", instanceId);
  }

  /**
   * Returns the cached client for an instance, creating it on first use.
   *
   * @throws ProviderInstanceNotFoundException if the instance is unknown or disabled
   */
  public ChatCompletionClient getClient(String instanceId) {
    return clients.computeIfAbsent(
        instanceId,
        id -> {
          ProviderInstance instance =
              providerInstanceRepository
                  .findById(id)
                  .filter(ProviderInstance::isEnabled)
                  .orElseThrow(() -> new ProviderInstanceNotFoundException(id));
          return clientFactory.create(instance);
        });
  }

  /** Lists an instance's models, served from cache until the TTL expires. */
  @Timed(value = "provider.listModels", description = "Time to list provider models")
  @CircuitBreaker(name = "providers", fallbackMethod = "listModelsFallback")
  public List<ModelInfo> listModels(String instanceId, boolean forceRefresh) {
    CachedModels cached = modelCache.get(instanceId);
    if (!forceRefresh && cached != null && !cached.isExpired(clock.instant(), ttl())) {
      return cached.models();
    }

    List<ModelInfo> models = getClient(instanceId).listModels();
    modelCache.put(instanceId, new CachedModels(models, clock.instant()));
    providerInstanceRepository
        .findById(instanceId)
        .ifPresent(
            instance -> {
              instance.setModelsCachedAt(LocalDateTime.now(clock));
              providerInstanceRepository.save(instance);
            });
    log.debug("Fetched {} models for provider instance {}", models.size(), instanceId);
    return models;
  }

  private List<ModelInfo> listModelsFallback(String instanceId, boolean forceRefresh, Throwable t) {
    CachedModels cached = modelCache.get(instanceId);
    if (cached == null || t instanceof ProviderInstanceNotFoundException) {
      log.error("Listing models failed for {}: {}", instanceId, t.getMessage());
      if (t instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Listing models failed", t);
    }
    log.warn("Listing models failed for {}, serving stale list: {}", instanceId, t.getMessage());
    return cached.models();
  }

  /**
   * Looks up pricing of a model. Any lookup failure yields empty so cost falls back to zero.
   *
   * @param instanceId the provider instance
   * @param modelId the model
   * @return pricing per million tokens, if the provider publishes it
   */
  public Optional<ModelPricing> findPricing(String instanceId, String modelId) {
    try {
      CachedModels cached = modelCache.get(instanceId);
      List<ModelInfo> models =
          cached != null ? cached.models() : getClient(instanceId).listModels();
      if (cached == null) {
        modelCache.put(instanceId, new CachedModels(models, clock.instant()));
      }
      return models.stream()
          .filter(model -> model.id().equals(modelId))
          .map(ModelInfo::pricing)
          .filter(pricing -> pricing != null)
          .findFirst();
    } catch (RuntimeException e) {
      log.warn("Pricing lookup failed for {}/{}: {}", instanceId, modelId, e.getMessage());
      return Optional.empty();
    }
  }

  /** Records that a chat completed against this instance and model. */
  @Transactional
  public void markUsed(String instanceId, String modelId) {
    providerInstanceRepository
        .findById(instanceId)
        .ifPresent(
            instance -> {
              instance.setLastUsedAt(LocalDateTime.now(clock));
              instance.setLastModelId(modelId);
              providerInstanceRepository.save(instance);
            });
  }

  private void invalidate(String instanceId) {
    clients.remove(instanceId);
    modelCache.remove(instanceId);
  }

  private Duration ttl() {
    return Duration.ofMillis(chatConfig.getProvider().getModelCacheTtlMs());
  }

  private record CachedModels(List<ModelInfo> models, Instant fetchedAt) {
    boolean isExpired(Instant now, Duration ttl) {
      return fetchedAt.plus(ttl).isBefore(now);
    }
  }
}
