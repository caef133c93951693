package com.company.simulation.cache;

import com.company.simulation.domain.ScenarioStats;
import com.company.simulation.domain.TimeseriesResult;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caches of one viewing session: stats batches per project and time series per
 * (project, scenario, metric, aggregation). Only the active project keeps entries.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class ProjectDataCache {

    private final SingleFlightCache<StatsCacheKey, List<ScenarioStats>> statsCache;
    private final SingleFlightCache<TimeseriesCacheKey, TimeseriesResult> timeseriesCache;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<String> activeProject = new AtomicReference<>();

    /**
     * Marks {@code projectId} as the viewed project. When this switches away from another
     * project, every entry of the previous project is dropped, and loads of other projects
     * still running complete for their waiters without being cached.
     *
     * @return the previously active project if it was replaced
     */
    public synchronized Optional<String> activate(String projectId) {
        String previous = activeProject.getAndSet(projectId);
        int stats = statsCache.retainOnlyProject(projectId);
        int series = timeseriesCache.retainOnlyProject(projectId);
        if (previous == null || previous.equals(projectId)) {
            return Optional.empty();
        }

        log.info("Active project switched from {} to {}; evicted {} stats and {} timeseries entries",
                previous, projectId, stats, series);
        return Optional.of(previous);
    }

    public Optional<String> getActiveProject() {
        return Optional.ofNullable(activeProject.get());
    }

    public synchronized void clear() {
        statsCache.clear();
        timeseriesCache.clear();
        activeProject.set(null);
    }
}
