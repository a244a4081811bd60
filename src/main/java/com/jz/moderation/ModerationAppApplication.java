package com.jz.moderation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.jz.moderation")
public class ModerationAppApplication {
    public static void main(String[] args) {
        SpringApplication.run(ModerationAppApplication.class);
    }
}
