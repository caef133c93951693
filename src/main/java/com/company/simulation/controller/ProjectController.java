package com.company.simulation.controller;

import com.company.simulation.domain.ProjectInfo;
import com.company.simulation.domain.ScenarioStats;
import com.company.simulation.domain.TimeseriesResult;
import com.company.simulation.dto.response.ProjectScenariosResponse;
import com.company.simulation.dto.response.ProjectSummaryResponse;
import com.company.simulation.dto.response.ScenarioStatsResponse;
import com.company.simulation.dto.response.TimeseriesResponse;
import com.company.simulation.service.ProjectQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/projects")
@Tag(name = "Projects", description = "Simulation projects, scenario KPIs and hourly results")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(summary = "List discovered projects")
    public ResponseEntity<List<ProjectSummaryResponse>> listProjects() {
        List<ProjectSummaryResponse> projects = queryService.listProjects().stream()
                .map(this::toProjectSummary)
                .collect(Collectors.toList());
        return ResponseEntity.ok(projects);
    }

    @GetMapping("/{projectId}/scenarios")
    @Operation(
            summary = "Yearly KPIs of every scenario in a project",
            description = "KPIs missing in the project store are returned as null"
    )
    public ResponseEntity<ProjectScenariosResponse> listScenarios(@PathVariable String projectId) {
        List<ScenarioStatsResponse> scenarios = queryService.getScenarioStats(projectId).stream()
                .map(this::toScenarioStatsResponse)
                .collect(Collectors.toList());

        ProjectScenariosResponse response = ProjectScenariosResponse.builder()
                .projectId(projectId)
                .scenarios(scenarios)
                .build();
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(response);
    }

    @GetMapping("/{projectId}/scenarios/{scenarioId}")
    @Operation(summary = "Yearly KPIs of one scenario")
    public ResponseEntity<ScenarioStatsResponse> getScenario(@PathVariable String projectId,
                                                             @PathVariable @Min(0) int scenarioId) {
        ScenarioStats stats = queryService.getScenarioStats(projectId, scenarioId);
        return ResponseEntity.ok(toScenarioStatsResponse(stats));
    }

    @GetMapping("/{projectId}/scenarios/{scenarioId}/timeseries")
    @Operation(
            summary = "Time series of one scenario metric",
            description = "Returns 8760 hourly, 365 daily or 12 calendar-month values"
    )
    public ResponseEntity<TimeseriesResponse> getTimeseries(
            @PathVariable String projectId,
            @PathVariable @Min(0) int scenarioId,
            @Parameter(description = "coolingLoad, heatingLoad, electricityConsumption or temperature")
            @RequestParam(defaultValue = "coolingLoad") String metric,
            @Parameter(description = "hourly, daily or monthly")
            @RequestParam(defaultValue = "hourly") String aggregation) {

        TimeseriesResult result = queryService.getTimeseries(projectId, scenarioId, metric, aggregation);

        meterRegistry.counter("api.timeseries.requests",
                "metric", result.getMetric().getWireName(),
                "aggregation", result.getAggregation().getWireName()
        ).increment();

        // Project outputs are immutable once produced
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(5, TimeUnit.MINUTES).cachePrivate())
                .body(toTimeseriesResponse(result));
    }

    private ProjectSummaryResponse toProjectSummary(ProjectInfo project) {
        List<Integer> scenarioIds = project.getScenarioIds();
        return ProjectSummaryResponse.builder()
                .id(project.getId())
                .name(project.getName())
                .country(project.getCountry())
                .year(project.getYear())
                .focus(project.getFocus())
                .scenarioCount(scenarioIds.size())
                .scenarioIds(scenarioIds)
                .build();
    }

    private ScenarioStatsResponse toScenarioStatsResponse(ScenarioStats stats) {
        return ScenarioStatsResponse.builder()
                .scenarioId(stats.getScenarioId())
                .totalCoolingLoad(stats.getTotalCoolingLoad())
                .avgCoolingLoad(stats.getAvgCoolingLoad())
                .peakCoolingLoad(stats.getPeakCoolingLoad())
                .totalElectricityDemand(stats.getTotalElectricityDemand())
                .totalEnergyCost(stats.getTotalEnergyCost())
                .peakElectricLoad(stats.getPeakElectricLoad())
                .timeseriesUnavailable(stats.isTimeseriesUnavailable())
                .build();
    }

    private TimeseriesResponse toTimeseriesResponse(TimeseriesResult result) {
        return TimeseriesResponse.builder()
                .scenarioId(result.getScenarioId())
                .metric(result.getMetric().getWireName())
                .aggregation(result.getAggregation().getWireName())
                .unit(result.getUnit())
                .timestamps(result.getTimestamps())
                .values(result.getValues())
                .build();
    }
}
