package com.flamingo.ai.vatreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VatReportApplication {

  public static void main(String[] args) {
    SpringApplication.run(VatReportApplication.class, args);
  }
}
