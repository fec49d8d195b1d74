package com.kalbot.stream;

import com.kalbot.config.KalbotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(KalbotProperties.class)
public class KalbotStreamApplication {

  public static void main(String[] args) {
    SpringApplication.run(KalbotStreamApplication.class, args);
  }
}
