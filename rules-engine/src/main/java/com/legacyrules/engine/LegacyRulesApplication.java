package com.legacyrules.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegacyRulesApplication {

  public static void main(String[] args) {
    SpringApplication.run(LegacyRulesApplication.class, args);
  }
}
