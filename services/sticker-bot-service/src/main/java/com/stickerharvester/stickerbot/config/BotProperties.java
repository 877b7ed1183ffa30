package com.stickerharvester.stickerbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bot settings bound from the {@code bot.*} namespace.
 *
 * <p>An empty token is accepted so the service can start without Telegram access (admin endpoints
 * and the local cache stay usable); a non-empty token must look like {@code 123456:ABC-def_}.
 */
@Validated
@ConfigurationProperties(prefix = "bot")
public record BotProperties(
    @Pattern(regexp = "^$|^[0-9]+:[A-Za-z0-9_-]+$", message = "malformed bot token") String token,
    String name,
    @NotBlank String apiBaseUrl,
    String timeZone,
    @Valid Storage storage,
    @Valid Polling polling,
    @Valid Queues queues,
    @Valid Shutdown shutdown,
    String commandsScope,
    List<@Valid Command> commands) {

  public BotProperties {
    token = token == null ? "" : token.trim();
    name = name == null ? "" : name.trim();
    apiBaseUrl = apiBaseUrl == null ? "https://api.telegram.org" : apiBaseUrl;
    timeZone = timeZone == null || timeZone.isBlank() ? "UTC" : timeZone;
    storage = storage == null ? new Storage("./bot-data") : storage;
    polling = polling == null ? new Polling(true, Duration.ofSeconds(5), 20) : polling;
    queues = queues == null ? new Queues(Duration.ofSeconds(1), 3) : queues;
    shutdown = shutdown == null ? new Shutdown(Duration.ofSeconds(30)) : shutdown;
    commandsScope = commandsScope == null || commandsScope.isBlank() ? "default" : commandsScope;
    commands = commands == null ? List.of() : List.copyOf(commands);
  }

  public boolean isConfigured() {
    return !token.isBlank();
  }

  public ZoneId zoneId() {
    return ZoneId.of(timeZone);
  }

  public record Storage(@NotBlank String root) {
    public Path rootPath() {
      return Path.of(root).toAbsolutePath().normalize();
    }

    public Path filesDir() {
      return rootPath().resolve("files");
    }

    public Path stickerSetsDir() {
      return rootPath().resolve("sticker-sets");
    }

    public Path databaseFile() {
      return rootPath().resolve("database").resolve("bot.db");
    }
  }

  public record Polling(boolean enabled, Duration interval, @Min(0) int timeoutSeconds) {}

  public record Queues(Duration interval, @Min(1) int maxAttempts) {}

  public record Shutdown(Duration gracePeriod) {}

  public record Command(@NotBlank String command, @NotBlank String description) {}
}
