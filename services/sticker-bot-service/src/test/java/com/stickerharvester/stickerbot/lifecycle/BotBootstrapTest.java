package com.stickerharvester.stickerbot.lifecycle;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.client.TelegramTransportException;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.polling.UpdatePoller;
import com.stickerharvester.stickerbot.support.TestBotProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class BotBootstrapTest {

  @TempDir Path root;

  private TelegramBotClient bot;
  private UpdatePoller poller;

  @BeforeEach
  void setUp() {
    bot = mock(TelegramBotClient.class);
    poller = mock(UpdatePoller.class);
  }

  @Test
  void configuredBotRegistersCommandsAndPolls() {
    BotProperties properties = TestBotProperties.create(root, "123:abc", Duration.ofSeconds(1));
    given(bot.isConfigured()).willReturn(true);
    given(bot.setMyCommands(properties.commands(), "default"))
        .willReturn(CompletableFuture.failedFuture(new TelegramTransportException("down")));

    new BotBootstrap(bot, poller, properties).run(new DefaultApplicationArguments());

    verify(bot).setMyCommands(properties.commands(), "default");
    verify(poller).start();
  }

  @Test
  void missingTokenLeavesPollingOff() {
    given(bot.isConfigured()).willReturn(false);

    new BotBootstrap(bot, poller, TestBotProperties.create(root)).run(new DefaultApplicationArguments());

    verify(bot, never()).setMyCommands(any(), anyString());
    verify(poller, never()).start();
  }
}
