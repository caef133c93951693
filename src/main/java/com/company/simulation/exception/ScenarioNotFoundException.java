package com.company.simulation.exception;

public class ScenarioNotFoundException extends SimulationDataException {
    public ScenarioNotFoundException(String projectId, int scenarioId) {
        super("Scenario " + scenarioId + " not found in project " + projectId);
    }
}
