package com.delta.searchsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SearchSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(SearchSyncApplication.class, args);
  }
}
