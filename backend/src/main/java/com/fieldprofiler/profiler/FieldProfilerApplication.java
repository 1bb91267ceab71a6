package com.fieldprofiler.profiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldProfilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(FieldProfilerApplication.class, args);
  }
}
