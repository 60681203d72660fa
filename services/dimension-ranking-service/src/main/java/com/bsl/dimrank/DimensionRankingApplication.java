package com.bsl.dimrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DimensionRankingApplication {
    public static void main(String[] args) {
        SpringApplication.run(DimensionRankingApplication.class, args);
    }
}
