package com.cointax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoinTaxApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoinTaxApplication.class, args);
    }
}
