package com.company.simulation.repository;

import com.company.simulation.domain.ScenarioFile;
import com.company.simulation.domain.enums.MetricKind;
import com.company.simulation.exception.DataCorruptException;
import com.company.simulation.exception.DataReadFailureException;
import com.company.simulation.exception.MetricUnsupportedException;
import com.company.simulation.util.ReferenceCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Reads hourly scenario files (gzip-compressed Parquet) through an in-memory DuckDB connection.
 */
@Repository
@Slf4j
public class ParquetTimeseriesReader implements TimeseriesReader {

    private static final String DUCKDB_URL = "jdbc:duckdb:";
    private static final String ROW_NUMBER_COLUMN = "file_row_number";
    private static final int INTERRUPT_CHECK_INTERVAL = 1024;
    private static final Set<String> NUMERIC_TYPES = Set.of(
            "TINYINT", "SMALLINT", "INTEGER", "BIGINT", "HUGEINT",
            "UTINYINT", "USMALLINT", "UINTEGER", "UBIGINT", "UHUGEINT",
            "FLOAT", "DOUBLE");

    @Override
    public double[] readRaw(ScenarioFile scenarioFile, MetricKind metric) {
        String path = scenarioFile.getPath().toAbsolutePath().toString();
        String source = "read_parquet(" + quoteLiteral(path) + ", " + ROW_NUMBER_COLUMN + " = true)";

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(DUCKDB_URL, true);
        long started = System.nanoTime();
        try {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

            Map<String, String> columnTypes = new HashMap<>();
            jdbcTemplate.query("DESCRIBE SELECT * FROM " + source,
                    (RowCallbackHandler) rs -> columnTypes.put(rs.getString("column_name"), rs.getString("column_type")));
            String columnType = columnTypes.get(metric.getColumn());
            if (columnType == null) {
                throw new MetricUnsupportedException(metric.getWireName(), metric.getColumn(),
                        scenarioFile.getPath().getFileName().toString());
            }
            if (!isNumericType(columnType)) {
                throw new DataCorruptException("Column " + metric.getColumn() + " has non-numeric type "
                        + columnType + " in " + scenarioFile.getPath());
            }

            String sql = "SELECT " + quoteIdentifier(metric.getColumn()) + " AS metric_value FROM " + source
                    + " ORDER BY " + ROW_NUMBER_COLUMN;
            double[] values = jdbcTemplate.query(sql, new HourlyValuesExtractor(scenarioFile, metric));

            log.debug("Read {} values of {} for scenario {} of project {} in {} ms",
                    values.length, metric.getColumn(), scenarioFile.getScenarioId(), scenarioFile.getProjectId(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return values;

        } catch (DataAccessException e) {
            throw new DataReadFailureException("Failed to read scenario file " + path, e);
        } finally {
            dataSource.destroy();
        }
    }

    static boolean isNumericType(String columnType) {
        String type = columnType.trim().toUpperCase(Locale.ROOT);
        return NUMERIC_TYPES.contains(type) || type.startsWith("DECIMAL");
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static final class HourlyValuesExtractor implements ResultSetExtractor<double[]> {

        private final ScenarioFile scenarioFile;
        private final MetricKind metric;

        private HourlyValuesExtractor(ScenarioFile scenarioFile, MetricKind metric) {
            this.scenarioFile = scenarioFile;
            this.metric = metric;
        }

        @Override
        public double[] extractData(ResultSet rs) throws SQLException {
            double[] values = new double[ReferenceCalendar.HOURS_PER_YEAR];
            int rows = 0;

            while (rs.next()) {
                if (rows % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                    throw new DataReadFailureException("Read of " + scenarioFile.getPath() + " was interrupted");
                }
                double value = rs.getDouble(1);
                if (rs.wasNull()) {
                    throw new DataCorruptException("Null " + metric.getColumn() + " value at hour " + rows
                            + " in " + scenarioFile.getPath());
                }
                if (rows < values.length) {
                    values[rows] = value;
                }
                rows++;
            }

            if (rows != ReferenceCalendar.HOURS_PER_YEAR) {
                throw new DataCorruptException("Expected " + ReferenceCalendar.HOURS_PER_YEAR + " rows but found "
                        + rows + " in " + scenarioFile.getPath());
            }
            return values;
        }
    }
}
