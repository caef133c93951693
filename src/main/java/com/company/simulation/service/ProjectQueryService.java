package com.company.simulation.service;

import com.company.simulation.cache.ProjectDataCache;
import com.company.simulation.cache.StatsCacheKey;
import com.company.simulation.cache.TimeseriesCacheKey;
import com.company.simulation.config.SimulationProperties;
import com.company.simulation.domain.ProjectInfo;
import com.company.simulation.domain.ScenarioFile;
import com.company.simulation.domain.ScenarioStats;
import com.company.simulation.domain.TimeseriesResult;
import com.company.simulation.domain.enums.Aggregation;
import com.company.simulation.domain.enums.MetricKind;
import com.company.simulation.exception.ScenarioNotFoundException;
import com.company.simulation.repository.ScenarioStatsRepository;
import com.company.simulation.repository.TimeseriesReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Read API over simulation projects. Resolves projects and scenarios through discovery
 * and serves the expensive reads through the {@link ProjectDataCache} it is given.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProjectQueryService {

    private final ProjectDiscoveryService discoveryService;
    private final ScenarioStatsRepository statsRepository;
    private final TimeseriesReader timeseriesReader;
    private final TimeseriesAggregator aggregator;
    private final ProjectDataCache cache;
    private final SimulationProperties properties;

    public List<ProjectInfo> listProjects() {
        return discoveryService.listProjects();
    }

    public List<ScenarioStats> getScenarioStats(String projectId) {
        return getScenarioStats(projectId, properties.getRequestTimeout());
    }

    public List<ScenarioStats> getScenarioStats(String projectId, Duration timeout) {
        ProjectInfo project = discoveryService.findProject(projectId);
        cache.activate(project.getId());

        return cache.getStatsCache().getOrCompute(
                new StatsCacheKey(project.getId()),
                () -> List.copyOf(statsRepository.findAll(project)),
                timeout);
    }

    public ScenarioStats getScenarioStats(String projectId, int scenarioId) {
        return getScenarioStats(projectId).stream()
                .filter(stats -> stats.getScenarioId() == scenarioId)
                .findFirst()
                .orElseThrow(() -> new ScenarioNotFoundException(projectId, scenarioId));
    }

    public TimeseriesResult getTimeseries(String projectId, int scenarioId, String metric, String aggregation) {
        return getTimeseries(projectId, scenarioId,
                MetricKind.fromWireName(metric), Aggregation.fromWireName(aggregation));
    }

    public TimeseriesResult getTimeseries(String projectId, int scenarioId, MetricKind metric, Aggregation aggregation) {
        return getTimeseries(projectId, scenarioId, metric, aggregation, properties.getRequestTimeout());
    }

    public TimeseriesResult getTimeseries(String projectId, int scenarioId, MetricKind metric,
                                          Aggregation aggregation, Duration timeout) {
        ProjectInfo project = discoveryService.findProject(projectId);
        if (!project.hasScenarioFile(scenarioId)) {
            throw new ScenarioNotFoundException(projectId, scenarioId);
        }
        cache.activate(project.getId());

        TimeseriesCacheKey key = new TimeseriesCacheKey(project.getId(), scenarioId, metric, aggregation);
        return cache.getTimeseriesCache().getOrCompute(
                key,
                () -> loadTimeseries(project, scenarioId, metric, aggregation),
                timeout);
    }

    private TimeseriesResult loadTimeseries(ProjectInfo project, int scenarioId,
                                            MetricKind metric, Aggregation aggregation) {
        ScenarioFile scenarioFile = discoveryService.requireReadableScenarioFile(project, scenarioId);
        double[] raw = timeseriesReader.readRaw(scenarioFile, metric);

        double[] aggregated = aggregator.aggregate(raw, aggregation);
        List<LocalDateTime> timestamps = aggregator.bucketStarts(aggregation);

        List<Double> values = new ArrayList<>(aggregated.length);
        for (double value : aggregated) {
            values.add(value);
        }

        log.debug("Computed {} {} values of {} for scenario {} of project {}",
                values.size(), aggregation.getWireName(), metric.getWireName(), scenarioId, project.getId());

        return TimeseriesResult.builder()
                .scenarioId(scenarioId)
                .metric(metric)
                .aggregation(aggregation)
                .unit(metric.getUnit())
                .timestamps(timestamps)
                .values(List.copyOf(values))
                .build();
    }
}
