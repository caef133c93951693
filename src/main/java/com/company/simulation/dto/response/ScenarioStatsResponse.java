package com.company.simulation.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScenarioStatsResponse {
    private Integer scenarioId;
    private Double totalCoolingLoad;
    private Double avgCoolingLoad;
    private Double peakCoolingLoad;
    private Double totalElectricityDemand;
    private Double totalEnergyCost;
    private Double peakElectricLoad;
    private Boolean timeseriesUnavailable;
}
