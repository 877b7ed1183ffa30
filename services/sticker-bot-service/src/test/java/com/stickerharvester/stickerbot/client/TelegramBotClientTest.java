package com.stickerharvester.stickerbot.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.stickerharvester.stickerbot.support.TestBotProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TelegramBotClientTest {

  private static final String BASE = "https://api.telegram.org/bot123:abc/";

  @TempDir Path root;

  private MockRestServiceServer server;
  private TelegramBotClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    client =
        new TelegramBotClient(
            builder.build(),
            Runnable::run,
            TestBotProperties.create(root, "123:abc", Duration.ofSeconds(30)));
  }

  private static Throwable failureOf(CompletableFuture<?> future) {
    assertThat(future).isCompletedExceptionally();
    try {
      future.join();
    } catch (CompletionException e) {
      return TelegramBotClient.unwrap(e);
    }
    throw new AssertionError("future did not fail");
  }

  @Test
  void firstPollOmitsOffset() {
    server
        .expect(requestTo(BASE + "getUpdates?timeout=20"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess("{\"ok\":true,\"result\":[]}", MediaType.APPLICATION_JSON));

    JsonNode result = client.getUpdates(null, 20).join();

    assertThat(result.isArray()).isTrue();
    server.verify();
  }

  @Test
  void laterPollsSendOffset() {
    server
        .expect(requestTo(BASE + "getUpdates?offset=42&timeout=20"))
        .andRespond(
            withSuccess(
                "{\"ok\":true,\"result\":[{\"update_id\":42}]}", MediaType.APPLICATION_JSON));

    assertThat(client.getUpdates(42L, 20).join().get(0).path("update_id").asLong())
        .isEqualTo(42);
  }

  @Test
  void stickerSetInvalidIsRecognised() {
    server
        .expect(requestTo(BASE + "getStickerSet?name=Nope"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    "{\"ok\":false,\"error_code\":400,"
                        + "\"description\":\"Bad Request: STICKERSET_INVALID\"}"));

    Throwable error = failureOf(client.getStickerSet("Nope"));

    assertThat(error).isInstanceOf(TelegramApiException.class);
    TelegramApiException api = (TelegramApiException) error;
    assertThat(api.isStickerSetInvalid()).isTrue();
    assertThat(api.isRetryable()).isFalse();
    assertThat(api.method()).isEqualTo("getStickerSet");
  }

  @Test
  void floodControlIsRetryable() {
    server
        .expect(requestTo(BASE + "getFile?file_id=F1"))
        .andRespond(
            withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    "{\"ok\":false,\"error_code\":429,"
                        + "\"description\":\"Too Many Requests: retry after 3\"}"));

    Throwable error = failureOf(client.getFile("F1"));

    assertThat(error).isInstanceOfSatisfying(
        TelegramApiException.class, api -> assertThat(api.isRetryable()).isTrue());
  }

  @Test
  void nonJsonAnswerIsATransportFailure() {
    server
        .expect(requestTo(BASE + "getFile?file_id=F1"))
        .andRespond(
            withStatus(HttpStatus.BAD_GATEWAY)
                .contentType(MediaType.TEXT_HTML)
                .body("<html>502</html>"));

    assertThat(failureOf(client.getFile("F1"))).isInstanceOf(TelegramTransportException.class);
  }

  @Test
  void downloadKeepsSlashesOfFilePath() {
    server
        .expect(requestTo("https://api.telegram.org/file/bot123:abc/stickers/file_7.webp"))
        .andRespond(
            withSuccess(new byte[] {7, 8}, MediaType.APPLICATION_OCTET_STREAM));

    assertThat(client.downloadFile("stickers/file_7.webp").join()).containsExactly(7, 8);
  }

  @Test
  void messageTextAndReplyAreEncoded() {
    String uri = client.messageUri(3, "50% & <b>ok</b>\n", 7L).toString();

    assertThat(uri)
        .startsWith(BASE + "sendMessage?parse_mode=html&chat_id=3&text=")
        .contains("text=50%25%20%26%20%3Cb%3Eok%3C%2Fb%3E%0A")
        .endsWith("&reply_parameters=%7B%22message_id%22%3A7%7D");
  }

  @Test
  void queryDelimitersInTextAreEncoded() {
    assertThat(client.messageUri(3, "a+b=c#d é", null).toString())
        .endsWith("&text=a%2Bb%3Dc%23d%20%C3%A9");
  }

  @Test
  void plainMessageHasNoReplyParameters() {
    assertThat(client.messageUri(3, "hi", null).toString())
        .isEqualTo(BASE + "sendMessage?parse_mode=html&chat_id=3&text=hi");
  }

  @Test
  void unconfiguredClientFailsWithoutRequest() {
    TelegramBotClient unconfigured =
        new TelegramBotClient(RestClient.create(), Runnable::run, TestBotProperties.create(root));

    assertThat(unconfigured.isConfigured()).isFalse();
    assertThat(failureOf(unconfigured.getStickerSet("Cats")))
        .isInstanceOf(TelegramTransportException.class);
  }

  @Test
  void unwrapStripsFutureWrappers() {
    IllegalStateException cause = new IllegalStateException("boom");

    assertThat(TelegramBotClient.unwrap(new CompletionException(cause))).isSameAs(cause);
    assertThatThrownBy(() -> CompletableFuture.failedFuture(cause).join())
        .isInstanceOf(CompletionException.class)
        .hasCause(cause);
  }
}
