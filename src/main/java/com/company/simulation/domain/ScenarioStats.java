package com.company.simulation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Yearly KPIs of one scenario. A null field means the store did not provide it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioStats {
    private int scenarioId;
    private Double totalCoolingLoad;
    private Double avgCoolingLoad;
    private Double peakCoolingLoad;
    private Double totalElectricityDemand;
    private Double totalEnergyCost;
    private Double peakElectricLoad;
    private boolean timeseriesUnavailable;
}
