package com.climbwatch.occupancy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "occupancy")
@Data
public class OccupancyProperties {

    /** GCP project id; blank means ask the metadata server */
    private String projectId = "";

    private Upstream upstream = new Upstream();
    private Storage storage = new Storage();
    private Database database = new Database();
    private Ingestion ingestion = new Ingestion();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Upstream {
        private String occupancyUrl = "https://portal.urbanclimb.com.au/uc-services/ajax/gym/occupancy.ashx?branch=";
        private String trendlineUrl = "https://api-prod.urbanclimb.com.au/widgets/trendline-data?branch=";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        /** Zone assumed for LastUpdated values that carry no offset */
        private String zone = "Australia/Brisbane";
        private int expectedSlotCount = 16;
    }

    @Data
    public static class Storage {
        private StorageMode mode = StorageMode.MEMORY;

        /**
         * Added to the UTC wall-clock time of last_updated before it is written, and
         * subtracted again on read. PT10H gives Brisbane local time in the table.
         */
        private Duration timestampOffset = Duration.ZERO;

        public enum StorageMode {
            MEMORY, JDBC
        }
    }

    @Data
    public static class Database {
        private String user;
        private String password;
        private String name;
        private String instanceConnectionName;
        private boolean privateIp = false;
        private int maxPoolSize = 5;
    }

    @Data
    public static class Ingestion {
        private Duration cycleTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Scheduling {
        /** Spring cron expression, "-" disables */
        private String occupancyCron = "-";
        private String attendanceCron = "-";
        private boolean runOnStartup = false;
    }
}
