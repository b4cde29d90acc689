package com.climbwatch.occupancy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// The DataSource is only built in JDBC storage mode, see StoreConfig
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
@EnableConfigurationProperties
public class OccupancyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OccupancyServiceApplication.class, args);
    }
}
