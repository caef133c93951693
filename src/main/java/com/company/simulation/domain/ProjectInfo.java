package com.company.simulation.domain;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * One project folder as seen by the latest discovery pass.
 * Scenario files are known by name only until they are first read.
 */
@Value
@Builder
public class ProjectInfo {
    String id;
    String name;
    String country;
    int year;
    String focus;
    Path path;
    Path outputDir;
    Path storePath;
    SortedMap<Integer, Path> scenarioFiles;

    public List<Integer> getScenarioIds() {
        return List.copyOf(scenarioFiles.keySet());
    }

    public boolean hasScenarioFile(int scenarioId) {
        return scenarioFiles.containsKey(scenarioId);
    }

    public Optional<Path> scenarioFile(int scenarioId) {
        return Optional.ofNullable(scenarioFiles.get(scenarioId));
    }
}
