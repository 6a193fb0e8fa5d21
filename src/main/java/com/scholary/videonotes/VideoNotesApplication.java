package com.scholary.videonotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class VideoNotesApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoNotesApplication.class, args);
  }
}
