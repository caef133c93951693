package com.company.simulation.config;

import com.company.simulation.cache.ProjectDataCache;
import com.company.simulation.cache.SingleFlightCache;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache metrics, one set of meters per cache tagged with its name.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final ProjectDataCache projectDataCache;

    @Bean
    public MeterBinder projectCacheMetrics() {
        return (registry) -> {
            bind(registry, projectDataCache.getStatsCache());
            bind(registry, projectDataCache.getTimeseriesCache());
            log.info("Project cache metrics registered");
        };
    }

    private void bind(MeterRegistry registry, SingleFlightCache<?, ?> cache) {
        Gauge.builder("simulation.cache.size", cache, SingleFlightCache::size)
                .description("Number of cached entries")
                .tag("cache", cache.getName())
                .register(registry);

        Gauge.builder("simulation.cache.inflight", cache, SingleFlightCache::inFlightCount)
                .description("Number of loads currently running")
                .tag("cache", cache.getName())
                .register(registry);

        FunctionCounter.builder("simulation.cache.hits", cache, SingleFlightCache::hitCount)
                .tag("cache", cache.getName())
                .register(registry);

        FunctionCounter.builder("simulation.cache.misses", cache, SingleFlightCache::missCount)
                .tag("cache", cache.getName())
                .register(registry);

        FunctionCounter.builder("simulation.cache.loads", cache, SingleFlightCache::loadCount)
                .description("Loads actually started, after collapsing concurrent requests")
                .tag("cache", cache.getName())
                .register(registry);

        FunctionCounter.builder("simulation.cache.evictions", cache, SingleFlightCache::evictionCount)
                .tag("cache", cache.getName())
                .register(registry);
    }
}
