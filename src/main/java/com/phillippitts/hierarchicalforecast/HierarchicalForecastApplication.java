package com.phillippitts.hierarchicalforecast;

import com.phillippitts.hierarchicalforecast.config.properties.ReconciliationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReconciliationProperties.class)
public class HierarchicalForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(HierarchicalForecastApplication.class, args);
    }

}
