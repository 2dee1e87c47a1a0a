package com.chicu.memetrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.memetrader")
public class MemeTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemeTraderApplication.class, args);
    }
}
