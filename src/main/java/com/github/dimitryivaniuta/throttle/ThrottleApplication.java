package com.github.dimitryivaniuta.throttle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(ThrottleProperties.class)
public class ThrottleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThrottleApplication.class, args);
    }
}
