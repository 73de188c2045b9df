package com.tcode.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * tcode bridge application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.tcode")
public class TcodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TcodeApplication.class, args);
    }
}
