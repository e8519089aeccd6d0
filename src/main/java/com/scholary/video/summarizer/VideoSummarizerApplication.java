package com.scholary.video.summarizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoSummarizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoSummarizerApplication.class, args);
  }
}
