package com.tsforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TimeSeriesForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeSeriesForecastApplication.class, args);
    }
}
