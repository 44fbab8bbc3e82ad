package com.flamingo.ai.nexuschat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the NexusChat back end. */
@SpringBootApplication
public class NexusChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(NexusChatApplication.class, args);
  }
}
