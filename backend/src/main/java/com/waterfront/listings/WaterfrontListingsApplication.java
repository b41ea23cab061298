package com.waterfront.listings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WaterfrontListingsApplication {

  public static void main(String[] args) {
    SpringApplication.run(WaterfrontListingsApplication.class, args);
  }
}
