package com.hifi.marketsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketSearchApplication.class, args);
  }
}
