/*
 * Where: Retention application entry point
 * What: Boots Spring, scans configuration properties and enables scheduling
 * Why: The purge worker and round re-triggers run on the Spring scheduler
 */
package com.example.retention;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class RetentionApplication {

  public static void main(String[] args) {
    SpringApplication.run(RetentionApplication.class, args);
  }
}
