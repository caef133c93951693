package com.company.simulation.domain;

import lombok.Value;

import java.nio.file.Path;

@Value
public class ScenarioFile {
    String projectId;
    int scenarioId;
    Path path;
}
