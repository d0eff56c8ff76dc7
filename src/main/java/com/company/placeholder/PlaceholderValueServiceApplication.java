package com.company.placeholder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PlaceholderValueServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlaceholderValueServiceApplication.class, args);
    }
}
