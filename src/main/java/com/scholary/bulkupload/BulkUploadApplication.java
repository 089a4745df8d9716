package com.scholary.bulkupload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BulkUploadApplication {

  public static void main(String[] args) {
    SpringApplication.run(BulkUploadApplication.class, args);
  }
}
