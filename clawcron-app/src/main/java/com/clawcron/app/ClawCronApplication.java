package com.clawcron.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * ClawCron application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.clawcron")
public class ClawCronApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawCronApplication.class, args);
    }
}
