package com.example.videoenhance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoEnhanceApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoEnhanceApplication.class, args);
  }
}
