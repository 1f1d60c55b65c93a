package com.flamingo.ai.llmchat.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.llmchat.domain.entity.ProviderInstance;
import com.flamingo.ai.llmchat.domain.enums.ProviderType;
import com.flamingo.ai.llmchat.exception.GlobalExceptionHandler;
import com.flamingo.ai.llmchat.exception.ProviderException;
import com.flamingo.ai.llmchat.service.provider.ModelInfo;
import com.flamingo.ai.llmchat.service.provider.ProviderManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ProviderController Tests")
class ProviderControllerTest {

  private MockMvc mockMvc;

  @Mock private ProviderManager providerManager;

  private ProviderInstance instance;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ProviderController(providerManager))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    instance =
        ProviderInstance.builder()
            .id("p1")
            .name("OpenRouter")
            .type(ProviderType.OPENAI_COMPATIBLE)
            .baseUrl("https://openrouter.ai/api/v1")
            .apiKey("sk-secret")
            .build();
    when(providerManager.saveInstance(any(ProviderInstance.class)))
        .thenAnswer(inv -> inv.getArgument(0));
  }

  @Test
  @DisplayName("Should never expose the API key")
  void shouldHideApiKey() throws Exception {
    when(providerManager.getInstances()).thenReturn(List.of(instance));

    mockMvc
        .perform(get("/api/providers"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].hasApiKey").value(true))
        .andExpect(jsonPath("$[0].apiKey").doesNotExist());
  }

  @Test
  void shouldCreateProvider() throws Exception {
    mockMvc
        .perform(
            post("/api/providers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"name\":\"Local\",\"type\":\"OPENAI_COMPATIBLE\","
                        + "\"baseUrl\":\"http://localhost:1234/v1\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("Local"))
        .andExpect(jsonPath("$.enabled").value(true));
  }

  @Test
  @DisplayName("Should keep the stored key when an update omits it")
  void shouldKeepApiKeyOnUpdate() throws Exception {
    when(providerManager.getInstance("p1")).thenReturn(instance);

    mockMvc
        .perform(
            put("/api/providers/{id}", "p1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"name\":\"Renamed\",\"type\":\"OPENAI_COMPATIBLE\","
                        + "\"baseUrl\":\"https://openrouter.ai/api/v1\"}"))
        .andExpect(status().isOk());

    ArgumentCaptor<ProviderInstance> saved = ArgumentCaptor.forClass(ProviderInstance.class);
    verify(providerManager).saveInstance(saved.capture());
    assertThat(saved.getValue().getName()).isEqualTo("Renamed");
    assertThat(saved.getValue().getApiKey()).isEqualTo("sk-secret");
  }

  @Test
  void shouldListModels() throws Exception {
    when(providerManager.listModels("p1", true))
        .thenReturn(List.of(new ModelInfo("openai/gpt-4o", "gpt-4o", 128000, null)));

    mockMvc
        .perform(get("/api/providers/{id}/models", "p1").param("refresh", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("gpt-4o"));
  }

  @Test
  @DisplayName("Should surface provider rate limits as 429")
  void shouldMapRateLimit() throws Exception {
    when(providerManager.listModels("p1", false))
        .thenThrow(new ProviderException(429, "10", "API error: 429"));

    mockMvc
        .perform(get("/api/providers/{id}/models", "p1"))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("PROVIDER_003"));
  }
}
