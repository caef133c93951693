package com.company.simulation.config;

import com.company.simulation.cache.ProjectDataCache;
import com.company.simulation.cache.SingleFlightCache;
import com.company.simulation.cache.StatsCacheKey;
import com.company.simulation.cache.TimeseriesCacheKey;
import com.company.simulation.domain.ScenarioStats;
import com.company.simulation.domain.TimeseriesResult;
import com.company.simulation.util.ReferenceCalendar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class CacheConfig {

    private final SimulationProperties properties;

    /**
     * Runs file reads off the request threads so a caller deadline can abandon them.
     */
    @Bean
    public ThreadPoolTaskExecutor projectReadExecutor() {
        ReferenceCalendar.requireNonLeap(properties.getReferenceYear());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getReader().getPoolSize());
        executor.setMaxPoolSize(properties.getReader().getPoolSize());
        executor.setQueueCapacity(properties.getReader().getQueueCapacity());
        executor.setThreadNamePrefix("project-read-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public ProjectDataCache projectDataCache(ThreadPoolTaskExecutor projectReadExecutor) {
        SingleFlightCache<StatsCacheKey, List<ScenarioStats>> statsCache = new SingleFlightCache<>(
                "scenarioStats", properties.getCache().getStatsMaximumSize(), projectReadExecutor);
        SingleFlightCache<TimeseriesCacheKey, TimeseriesResult> timeseriesCache = new SingleFlightCache<>(
                "timeseries", properties.getCache().getTimeseriesMaximumSize(), projectReadExecutor);

        log.info("Project data cache configured (stats: {}, timeseries: {} entries)",
                properties.getCache().getStatsMaximumSize(), properties.getCache().getTimeseriesMaximumSize());
        return new ProjectDataCache(statsCache, timeseriesCache);
    }
}
