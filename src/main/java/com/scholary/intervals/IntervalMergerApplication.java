package com.scholary.intervals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntervalMergerApplication {

  public static void main(String[] args) {
    SpringApplication.run(IntervalMergerApplication.class, args);
  }
}
