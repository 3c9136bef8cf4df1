package com.elssolution.seneccollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SenecCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SenecCollectorApplication.class, args);
    }

}
