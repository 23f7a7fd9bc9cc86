package com.trending.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TrendingTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TrendingTrackerApplication.class, args);
  }
}
