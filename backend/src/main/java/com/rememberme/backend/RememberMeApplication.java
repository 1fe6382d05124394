package com.rememberme.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class RememberMeApplication {

    public static void main(String[] args) {
        // login timestamps and cleaner schedules are UTC
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(RememberMeApplication.class, args);
    }

    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingConfig {
    }
}
