package io.casetime.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.casetime")
public class CtApplication {
    public static void main(String[] args) {
        SpringApplication.run(CtApplication.class, args);
    }
}
