package com.company.simulation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "simulation")
@Data
public class SimulationProperties {

    /**
     * Directory holding one folder per project, e.g. {@code projects/AUT_2020_cooling}.
     */
    private String projectsRoot = "projects";

    /**
     * Non-leap year whose calendar labels the 8760 hourly rows.
     */
    private int referenceYear = 2001;

    /**
     * Deadline for a single stats or time series request.
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    private Cache cache = new Cache();

    private Reader reader = new Reader();

    private Cors cors = new Cors();

    public Path projectsRootPath() {
        return Path.of(projectsRoot).toAbsolutePath().normalize();
    }

    @Data
    public static class Cache {
        private int statsMaximumSize = 64;
        private int timeseriesMaximumSize = 512;
    }

    @Data
    public static class Reader {
        private int poolSize = 8;
        private int queueCapacity = 256;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
