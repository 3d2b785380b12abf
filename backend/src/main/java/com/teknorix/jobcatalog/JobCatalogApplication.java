package com.teknorix.jobcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobCatalogApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobCatalogApplication.class, args);
  }
}
