package com.stickerharvester.stickerbot.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class TelegramClientConfig {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration READ_MARGIN = Duration.ofSeconds(15);

  @Bean
  public RestClient telegramRestClient(RestClient.Builder builder, BotProperties properties) {
    // long polls hold the connection open for timeoutSeconds
    Duration readTimeout =
        Duration.ofSeconds(properties.polling().timeoutSeconds()).plus(READ_MARGIN);
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
    requestFactory.setReadTimeout(readTimeout);
    return builder.requestFactory(requestFactory).build();
  }
}
