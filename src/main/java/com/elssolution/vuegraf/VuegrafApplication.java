package com.elssolution.vuegraf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@ConfigurationPropertiesScan
@SpringBootApplication
public class VuegrafApplication {

    public static void main(String[] args) {
        SpringApplication.run(VuegrafApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
