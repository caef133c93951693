package com.company.simulation.exception;

public class ProjectNotFoundException extends SimulationDataException {
    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
    }
}
