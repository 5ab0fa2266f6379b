package com.steadycrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SteadyCrawlApplication {

  public static void main(String[] args) {
    SpringApplication.run(SteadyCrawlApplication.class, args);
  }
}
