package com.polybot.crypto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CryptoTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoTraderApplication.class, args);
    }
}
