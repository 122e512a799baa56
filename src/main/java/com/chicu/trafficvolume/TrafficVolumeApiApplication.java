package com.chicu.trafficvolume;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication(scanBasePackages = "com.chicu.trafficvolume")
public class TrafficVolumeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrafficVolumeApiApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
