package com.purchasingpower.cora;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CoraApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoraApplication.class, args);
    }
}
