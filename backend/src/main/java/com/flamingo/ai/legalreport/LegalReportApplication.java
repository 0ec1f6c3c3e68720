package com.flamingo.ai.legalreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalReportApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LegalReportApplication.class, args)));
  }
}
