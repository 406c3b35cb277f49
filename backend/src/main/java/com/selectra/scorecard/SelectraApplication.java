package com.selectra.scorecard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SelectraApplication {

    public static void main(String[] args) {
        SpringApplication.run(SelectraApplication.class, args);
    }
}
