package com.projectgroup5.pongarena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PongArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(PongArenaApplication.class, args);
    }
}
