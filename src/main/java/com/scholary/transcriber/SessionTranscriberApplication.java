package com.scholary.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SessionTranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(SessionTranscriberApplication.class, args);
  }
}
