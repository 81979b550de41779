package com.sitelens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteLensApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteLensApplication.class, args);
  }
}
