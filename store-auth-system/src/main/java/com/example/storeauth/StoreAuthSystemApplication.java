package com.example.storeauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

@SpringBootApplication
@EnableJpaAuditing
@ConfigurationPropertiesScan
public class StoreAuthSystemApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreAuthSystemApplication.class, args);
    }

}
