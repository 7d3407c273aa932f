package com.tradeiq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.tradeiq.shared.config")
public class TradeIqSignerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeIqSignerApplication.class, args);
    }
}
