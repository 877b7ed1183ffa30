package com.stickerharvester.stickerbot.lifecycle;

import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.polling.UpdatePoller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Registers the command menu and starts polling once the context is up. */
@Component
@Slf4j
@RequiredArgsConstructor
public class BotBootstrap implements ApplicationRunner {

  private final TelegramBotClient bot;
  private final UpdatePoller poller;
  private final BotProperties properties;

  @Override
  public void run(ApplicationArguments args) {
    if (!bot.isConfigured()) {
      log.warn("bot.token is empty; Telegram polling is disabled");
      return;
    }
    if (!properties.commands().isEmpty()) {
      bot.setMyCommands(properties.commands(), properties.commandsScope())
          .whenComplete(
              (result, error) -> {
                if (error != null) {
                  log.warn(
                      "setMyCommands failed: {}", TelegramBotClient.unwrap(error).getMessage());
                } else {
                  log.info("Registered {} bot commands", properties.commands().size());
                }
              });
    }
    if (properties.polling().enabled()) {
      poller.start();
    } else {
      log.info("bot.polling.enabled=false; polling is skipped");
    }
  }
}
