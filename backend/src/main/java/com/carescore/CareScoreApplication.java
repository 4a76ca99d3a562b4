package com.carescore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CareScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareScoreApplication.class, args);
    }
}
