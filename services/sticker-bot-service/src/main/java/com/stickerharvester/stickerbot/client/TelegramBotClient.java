package com.stickerharvester.stickerbot.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.stickerharvester.stickerbot.config.BotProperties;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Bot API calls used by the harvester. Every call runs on the I/O executor and yields the
 * envelope's {@code result}; {@code ok=false} surfaces as {@link TelegramApiException}, anything
 * that prevented reading an envelope as {@link TelegramTransportException}.
 */
@Service
@Slf4j
public class TelegramBotClient {

  private static final MediaType ZIP = MediaType.parseMediaType("application/zip");

  private final RestClient rest;
  private final Executor io;
  private final String apiBaseUrl;
  private final String botToken;

  public TelegramBotClient(
      @Qualifier("telegramRestClient") RestClient rest,
      @Qualifier("telegramIoExecutor") Executor io,
      BotProperties properties) {
    this.rest = rest;
    this.io = io;
    this.apiBaseUrl = trimSlash(properties.apiBaseUrl());
    this.botToken = properties.token();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  /** Long poll; {@code offset} may be null before the first update was ever seen. */
  public CompletableFuture<JsonNode> getUpdates(Long offset, int timeoutSeconds) {
    return async(
        "getUpdates",
        () -> {
          RestClient.RequestHeadersSpec<?> spec =
              offset == null
                  ? rest.get().uri(methodUrl("getUpdates") + "?timeout={timeout}", timeoutSeconds)
                  : rest.get()
                      .uri(
                          methodUrl("getUpdates") + "?offset={offset}&timeout={timeout}",
                          offset,
                          timeoutSeconds);
          return spec.exchange((req, res) -> readEnvelope("getUpdates", res));
        });
  }

  public CompletableFuture<JsonNode> getFile(String fileId) {
    return async(
        "getFile",
        () ->
            rest.get()
                .uri(methodUrl("getFile") + "?file_id={id}", fileId)
                .exchange((req, res) -> readEnvelope("getFile", res)));
  }

  /** Raw bytes behind a {@code file_path} returned by {@link #getFile}. */
  public CompletableFuture<byte[]> downloadFile(String filePath) {
    return async(
        "downloadFile",
        () ->
            rest.get()
                .uri(URI.create(apiBaseUrl + "/file/bot" + botToken + "/" + filePath))
                .exchange(
                    (req, res) -> {
                      if (!res.getStatusCode().is2xxSuccessful()) {
                        throw new TelegramApiException(
                            "downloadFile", res.getStatusCode().value(), res.getStatusText());
                      }
                      byte[] body = res.bodyTo(byte[].class);
                      return body == null ? new byte[0] : body;
                    }));
  }

  public CompletableFuture<JsonNode> getStickerSet(String name) {
    return async(
        "getStickerSet",
        () ->
            rest.get()
                .uri(methodUrl("getStickerSet") + "?name={name}", name)
                .exchange((req, res) -> readEnvelope("getStickerSet", res)));
  }

  public CompletableFuture<JsonNode> sendMessage(long chatId, String text) {
    return send(messageUri(chatId, text, null));
  }

  public CompletableFuture<JsonNode> sendReply(long chatId, long replyToMessageId, String text) {
    return send(messageUri(chatId, text, replyToMessageId));
  }

  public CompletableFuture<JsonNode> sendDocument(long chatId, Path document) {
    return async(
        "sendDocument",
        () -> {
          MultipartBodyBuilder parts = new MultipartBodyBuilder();
          parts.part("chat_id", Long.toString(chatId));
          parts
              .part("document", new FileSystemResource(document))
              .contentType(ZIP)
              .filename(document.getFileName().toString());
          return rest.post()
              .uri(methodUrl("sendDocument"))
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .body(parts.build())
              .exchange((req, res) -> readEnvelope("sendDocument", res));
        });
  }

  public CompletableFuture<JsonNode> setMyCommands(
      List<BotProperties.Command> commands, String scope) {
    return async(
        "setMyCommands",
        () -> {
          List<Map<String, Object>> items = new ArrayList<>();
          for (BotProperties.Command c : commands) {
            items.add(Map.of("command", c.command(), "description", c.description()));
          }
          Map<String, Object> body = new HashMap<>();
          body.put("commands", items);
          body.put("scope", Map.of("type", scope));
          return rest.post()
              .uri(methodUrl("setMyCommands"))
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .exchange((req, res) -> readEnvelope("setMyCommands", res));
        });
  }

  /** Strips the {@link CompletionException}/{@link ExecutionException} wrappers of a future. */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private CompletableFuture<JsonNode> send(URI uri) {
    return async(
        "sendMessage",
        () -> rest.get().uri(uri).exchange((req, res) -> readEnvelope("sendMessage", res)));
  }

  URI messageUri(long chatId, String text, Long replyToMessageId) {
    UriComponentsBuilder url =
        UriComponentsBuilder.fromUriString(methodUrl("sendMessage"))
            .queryParam("parse_mode", "html")
            .queryParam("chat_id", "{chat}")
            .queryParam("text", "{text}");
    Map<String, Object> vars = new HashMap<>();
    vars.put("chat", chatId);
    vars.put("text", text == null ? "" : text);
    if (replyToMessageId != null) {
      url.queryParam("reply_parameters", "{reply}");
      vars.put("reply", "{\"message_id\":" + replyToMessageId + "}");
    }
    return url.encode().buildAndExpand(vars).toUri();
  }

  private <T> CompletableFuture<T> async(String method, Supplier<T> call) {
    if (!isConfigured()) {
      return CompletableFuture.failedFuture(
          new TelegramTransportException("Bot token is not configured; skip " + method));
    }
    return CompletableFuture.supplyAsync(
        () -> {
          try {
            return call.get();
          } catch (RestClientException e) {
            if (e.getCause() instanceof TelegramApiException api) {
              throw api;
            }
            throw new TelegramTransportException(method + " failed: " + e.getMessage(), e);
          }
        },
        io);
  }

  private static JsonNode readEnvelope(String method, ConvertibleClientHttpResponse response)
      throws IOException {
    JsonNode envelope;
    try {
      envelope = response.bodyTo(JsonNode.class);
    } catch (RestClientException e) {
      throw new TelegramTransportException(
          method + " returned HTTP " + response.getStatusCode().value() + " without JSON", e);
    }
    if (envelope == null) {
      throw new TelegramTransportException(
          method + " returned HTTP " + response.getStatusCode().value() + " with empty body");
    }
    if (envelope.path("ok").asBoolean(false)) {
      return envelope.path("result");
    }
    throw new TelegramApiException(
        method,
        envelope.path("error_code").asInt(response.getStatusCode().value()),
        envelope.path("description").asText(""));
  }

  private String methodUrl(String method) {
    return apiBaseUrl + "/bot" + botToken + "/" + method;
  }

  private static String trimSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
