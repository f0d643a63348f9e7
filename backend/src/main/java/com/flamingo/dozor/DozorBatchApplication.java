package com.flamingo.dozor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the dozor batch coordinator. */
@SpringBootApplication
public class DozorBatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DozorBatchApplication.class, args);
  }
}
