package com.scholary.chapters;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChapterMergerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChapterMergerApplication.class, args);
  }
}
