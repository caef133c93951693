package com.company.simulation.repository;

/**
 * Fixed mapping from the yearly results table to {@code ScenarioStats} fields.
 */
enum StatsColumn {
    SCENARIO_ID("ID_Scenario", true),
    TOTAL_COOLING_LOAD("Q_RoomCooling", false),
    TOTAL_ENERGY_COST("TotalCost", false),
    TOTAL_ELECTRICITY_DEMAND("Load", false),
    PEAK_COOLING_LOAD("PeakCoolingLoad", false),
    PEAK_ELECTRIC_LOAD("PeakElectricLoad", false);

    private final String column;
    private final boolean required;

    StatsColumn(String column, boolean required) {
        this.column = column;
        this.required = required;
    }

    String column() {
        return column;
    }

    boolean isRequired() {
        return required;
    }
}
