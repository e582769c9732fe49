package com.stockgame;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StockGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockGameApplication.class, args);
    }
}
