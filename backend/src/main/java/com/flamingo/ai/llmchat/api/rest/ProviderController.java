package com.flamingo.ai.llmchat.api.rest;

import com.flamingo.ai.llmchat.api.dto.request.SaveProviderRequest;
import com.flamingo.ai.llmchat.api.dto.response.ProviderResponse;
import com.flamingo.ai.llmchat.domain.entity.ProviderInstance;
import com.flamingo.ai.llmchat.service.provider.ModelInfo;
import com.flamingo.ai.llmchat.service.provider.ProviderManager;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for provider instances and their models. */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

  private final ProviderManager providerManager;

  @GetMapping
  public ResponseEntity<List<ProviderResponse>> getAllProviders() {
    return ResponseEntity.ok(
        providerManager.getInstances().stream().map(ProviderResponse::fromEntity).toList());
  }

  @GetMapping("/{providerId}")
  public ResponseEntity<ProviderResponse> getProvider(@PathVariable String providerId) {
    return ResponseEntity.ok(ProviderResponse.fromEntity(providerManager.getInstance(providerId)));
  }

  /** Creates a provider instance. */
  @PostMapping
  public ResponseEntity<ProviderResponse> createProvider(
      @Valid @RequestBody SaveProviderRequest request) {
    ProviderInstance instance =
        ProviderInstance.builder()
            .name(request.getName())
            .type(request.getType())
            .baseUrl(request.getBaseUrl())
            .apiKey(request.getApiKey())
            .enabled(request.getEnabled() == null || request.getEnabled())
            .build();
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ProviderResponse.fromEntity(providerManager.saveInstance(instance)));
  }

  /** Updates a provider instance; a missing API key keeps the stored one. */
  @PutMapping("/{providerId}")
  public ResponseEntity<ProviderResponse> updateProvider(
      @PathVariable String providerId, @Valid @RequestBody SaveProviderRequest request) {
    ProviderInstance instance = providerManager.getInstance(providerId);
    instance.setName(request.getName());
    instance.setType(request.getType());
    instance.setBaseUrl(request.getBaseUrl());
    if (request.getApiKey() != null) {
      instance.setApiKey(request.getApiKey());
    }
    if (request.getEnabled() != null) {
      instance.setEnabled(request.getEnabled());
    }
    return ResponseEntity.ok(ProviderResponse.fromEntity(providerManager.saveInstance(instance)));
  }

  @DeleteMapping("/{providerId}")
  public ResponseEntity<Void> deleteProvider(@PathVariable String providerId) {
    providerManager.deleteInstance(providerId);
    return ResponseEntity.noContent().build();
  }

  /** Lists the models of a provider, from cache unless {@code refresh} is set. */
  @GetMapping("/{providerId}/models")
  public ResponseEntity<List<ModelInfo>> getModels(
      @PathVariable String providerId, @RequestParam(defaultValue = "false") boolean refresh) {
    return ResponseEntity.ok(providerManager.listModels(providerId, refresh));
  }
}
