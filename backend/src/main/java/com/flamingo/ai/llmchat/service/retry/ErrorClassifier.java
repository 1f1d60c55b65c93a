package com.flamingo.ai.llmchat.service.retry;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;
import com.flamingo.ai.llmchat.exception.ProviderException;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/** Maps provider, network and cancellation failures onto {@link ErrorCategory}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorClassifier {

  private final Clock clock;

  public ClassifiedError classify(Throwable failure) {
    Throwable error = Exceptions.unwrap(failure);
    Throwable current = error;
    while (current != null) {
      ClassifiedError classified = classifyType(current);
      if (classified != null) {
        return classified;
      }
      current = current.getCause() != current ? current.getCause() : null;
    }
    return fromMessage(error.getMessage(), error);
  }

  /** Classifies a failure event, preferring its cause when one is attached. */
  public ClassifiedError classify(ChatStreamEvent.Failure failure) {
    if (failure.cause() != null) {
      return classify(failure.cause());
    }
    return fromMessage(failure.message(), null);
  }

  /**
   * Parses a Retry-After header value given either as seconds or as an HTTP date.
   *
   * @return delay in milliseconds (never negative), or null when absent or unparseable
   */
  public Long parseRetryAfter(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    try {
      return Math.max(0L, Long.parseLong(trimmed) * 1000);
    } catch (NumberFormatException notSeconds) {
      try {
        ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
        return Math.max(0L, Duration.between(clock.instant(), date.toInstant()).toMillis());
      } catch (DateTimeParseException notDate) {
        log.debug("Ignoring unparseable Retry-After value: {}", trimmed);
        return null;
      }
    }
  }

  private ClassifiedError classifyType(Throwable error) {
    if (error instanceof CancellationException) {
      return of(ErrorCategory.CANCELLED, null, null, error);
    }
    if (error instanceof ProviderException provider && provider.getStatus() > 0) {
      return fromStatus(provider.getStatus(), parseRetryAfter(provider.getRetryAfter()), error);
    }
    if (error instanceof WebClientResponseException response) {
      return fromStatus(
          response.getStatusCode().value(),
          parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)),
          error);
    }
    if (error instanceof TimeoutException
        || error instanceof SocketTimeoutException
        || error instanceof HttpTimeoutException) {
      return of(ErrorCategory.TIMEOUT, null, null, error);
    }
    if (error instanceof WebClientRequestException request) {
      ClassifiedError cause = request.getCause() != null ? classifyType(request.getCause()) : null;
      return cause != null ? cause : of(ErrorCategory.NETWORK, null, null, error);
    }
    if (error instanceof ConnectException || error instanceof UnknownHostException) {
      return of(ErrorCategory.NETWORK, null, null, error);
    }
    return null;
  }

  private ClassifiedError fromStatus(int status, Long retryAfterMs, Throwable error) {
    ErrorCategory category;
    if (status == 401 || status == 403) {
      category = ErrorCategory.AUTH;
    } else if (status == 402) {
      category = ErrorCategory.BILLING;
    } else if (status == 404) {
      category = ErrorCategory.NOT_FOUND;
    } else if (status == 429) {
      category = ErrorCategory.RATE_LIMIT;
    } else if (status >= 500 && status < 600) {
      category = ErrorCategory.SERVER;
    } else {
      return new ClassifiedError(
          ErrorCategory.UNKNOWN, unknownMessage(error.getMessage()), status, null, error);
    }
    Long hint = category == ErrorCategory.RATE_LIMIT ? retryAfterMs : null;
    return new ClassifiedError(category, category.getUserMessage(), status, hint, error);
  }

  private ClassifiedError fromMessage(String message, Throwable error) {
    String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
    if (text.contains("network") || text.contains("connection")) {
      return of(ErrorCategory.NETWORK, null, null, error);
    }
    if (text.contains("timeout") || text.contains("timed out")) {
      return of(ErrorCategory.TIMEOUT, null, null, error);
    }
    if (text.contains("rate") && text.contains("limit")) {
      return of(ErrorCategory.RATE_LIMIT, null, null, error);
    }
    return new ClassifiedError(ErrorCategory.UNKNOWN, unknownMessage(message), null, null, error);
  }

  private static ClassifiedError of(
      ErrorCategory category, Integer status, Long retryAfterMs, Throwable error) {
    return new ClassifiedError(category, category.getUserMessage(), status, retryAfterMs, error);
  }

  private static String unknownMessage(String message) {
    return message != null && !message.isBlank() ? message : ErrorCategory.UNKNOWN.getUserMessage();
  }
}
