package com.company.simulation.repository;

import com.company.simulation.domain.ProjectInfo;
import com.company.simulation.domain.ScenarioStats;
import com.company.simulation.exception.DataCorruptException;
import com.company.simulation.exception.DataReadFailureException;
import com.company.simulation.util.ReferenceCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Repository;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads yearly per-scenario KPIs from a project's SQLite store.
 */
@Repository
@Slf4j
public class ScenarioStatsRepository {

    static final String YEARLY_TABLE = "OperationResult_RefYear";

    private static final String TABLE_EXISTS_SQL = """
            SELECT COUNT(*)
            FROM sqlite_master
            WHERE type = 'table' AND name = ?
            """;

    private static final String SELECT_YEARLY = "SELECT * FROM " + YEARLY_TABLE;

    public List<ScenarioStats> findAll(ProjectInfo project) {
        Path store = project.getStorePath();
        JdbcTemplate jdbcTemplate = new JdbcTemplate(readOnlyDataSource(store));

        try {
            Integer tables = jdbcTemplate.queryForObject(TABLE_EXISTS_SQL, Integer.class, YEARLY_TABLE);
            if (tables == null || tables == 0) {
                throw new DataCorruptException("Table " + YEARLY_TABLE + " missing in " + store);
            }

            List<ScenarioStats> stats = jdbcTemplate.query(SELECT_YEARLY, new YearlyResultsExtractor(project));
            log.debug("Read {} scenario rows from {}", stats.size(), store);
            return stats;

        } catch (DataAccessException e) {
            throw new DataReadFailureException("Failed to read relational store " + store, e);
        }
    }

    private static DriverManagerDataSource readOnlyDataSource(Path store) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + store.toAbsolutePath());
        dataSource.setConnectionProperties(config.toProperties());
        return dataSource;
    }

    private static final class YearlyResultsExtractor implements ResultSetExtractor<List<ScenarioStats>> {

        private final ProjectInfo project;

        private YearlyResultsExtractor(ProjectInfo project) {
            this.project = project;
        }

        @Override
        public List<ScenarioStats> extractData(ResultSet rs) throws SQLException {
            Map<StatsColumn, Integer> columns = resolveColumns(rs.getMetaData());
            List<ScenarioStats> results = new ArrayList<>();
            Set<Integer> seen = new HashSet<>();

            while (rs.next()) {
                int scenarioId = readScenarioId(rs, columns.get(StatsColumn.SCENARIO_ID));
                if (!seen.add(scenarioId)) {
                    log.warn("Duplicate row for scenario {} in {} of project {}; keeping the first",
                            scenarioId, YEARLY_TABLE, project.getId());
                    continue;
                }

                Double totalCooling = readNumber(rs, columns, StatsColumn.TOTAL_COOLING_LOAD);
                results.add(ScenarioStats.builder()
                        .scenarioId(scenarioId)
                        .totalCoolingLoad(totalCooling)
                        .avgCoolingLoad(totalCooling != null ? totalCooling / ReferenceCalendar.HOURS_PER_YEAR : null)
                        .peakCoolingLoad(readNumber(rs, columns, StatsColumn.PEAK_COOLING_LOAD))
                        .totalElectricityDemand(readNumber(rs, columns, StatsColumn.TOTAL_ELECTRICITY_DEMAND))
                        .totalEnergyCost(readNumber(rs, columns, StatsColumn.TOTAL_ENERGY_COST))
                        .peakElectricLoad(readNumber(rs, columns, StatsColumn.PEAK_ELECTRIC_LOAD))
                        .timeseriesUnavailable(!project.hasScenarioFile(scenarioId))
                        .build());
            }

            results.sort(Comparator.comparingInt(ScenarioStats::getScenarioId));
            return results;
        }

        private Map<StatsColumn, Integer> resolveColumns(ResultSetMetaData metaData) throws SQLException {
            Map<StatsColumn, Integer> columns = new EnumMap<>(StatsColumn.class);
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                String label = metaData.getColumnLabel(i);
                for (StatsColumn column : StatsColumn.values()) {
                    if (column.column().equalsIgnoreCase(label)) {
                        columns.putIfAbsent(column, i);
                    }
                }
            }

            for (StatsColumn column : StatsColumn.values()) {
                if (columns.containsKey(column)) {
                    continue;
                }
                if (column.isRequired()) {
                    throw new DataCorruptException("Required column " + column.column() + " missing in "
                            + YEARLY_TABLE + " of project " + project.getId());
                }
                log.warn("Column {} missing in {} of project {}; reporting it as unavailable",
                        column.column(), YEARLY_TABLE, project.getId());
            }
            return columns;
        }

        private int readScenarioId(ResultSet rs, int index) throws SQLException {
            Double value = toDouble(rs.getObject(index), StatsColumn.SCENARIO_ID);
            if (value == null || value != Math.rint(value) || value < 0 || value > Integer.MAX_VALUE) {
                throw new DataCorruptException("Invalid " + StatsColumn.SCENARIO_ID.column() + " value "
                        + value + " in project " + project.getId());
            }
            return value.intValue();
        }

        private Double readNumber(ResultSet rs, Map<StatsColumn, Integer> columns, StatsColumn column)
                throws SQLException {
            Integer index = columns.get(column);
            if (index == null) {
                return null;
            }
            return toDouble(rs.getObject(index), column);
        }

        private Double toDouble(Object value, StatsColumn column) {
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new DataCorruptException("Non-numeric value '" + value + "' in column "
                        + column.column() + " of project " + project.getId(), e);
            }
        }
    }
}
