package com.mindthread.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MindThreadApplication {

  public static void main(String[] args) {
    SpringApplication.run(MindThreadApplication.class, args);
  }
}
