package com.docvault.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocumentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentSearchApplication.class, args);
    }
}
