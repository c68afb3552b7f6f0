package com.optionanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionAnalyticsApplication.class, args);
    }
}
