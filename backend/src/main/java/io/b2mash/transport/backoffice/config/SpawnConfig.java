package io.b2mash.transport.backoffice.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SpawnProperties.class)
public class SpawnConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
