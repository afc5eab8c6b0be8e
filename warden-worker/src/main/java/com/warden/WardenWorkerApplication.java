package com.warden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WardenWorkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(WardenWorkerApplication.class, args);
  }
}
