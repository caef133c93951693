package com.company.simulation.repository;

import com.company.simulation.domain.ProjectInfo;
import com.company.simulation.domain.ScenarioStats;
import com.company.simulation.exception.DataCorruptException;
import com.company.simulation.support.ProjectFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScenarioStatsRepositoryTest {

    @TempDir
    Path dir;

    private final ScenarioStatsRepository repository = new ScenarioStatsRepository();

    private ProjectInfo project(Path store, int... scenarioFiles) {
        TreeMap<Integer, Path> files = new TreeMap<>();
        for (int id : scenarioFiles) {
            files.put(id, dir.resolve(ProjectFixtures.scenarioFileName(id)));
        }
        return ProjectInfo.builder()
                .id("AUT_2020_cooling")
                .name("AUT 2020 Cooling")
                .country("AUT")
                .year(2020)
                .focus("cooling")
                .path(dir)
                .outputDir(dir)
                .storePath(store)
                .scenarioFiles(files)
                .build();
    }

    @Test
    @DisplayName("Rows are mapped to KPIs with the average derived from the yearly total")
    void findAll_mapsRows() throws Exception {
        // Arrange
        Path store = dir.resolve("AUT_2020_cooling.sqlite");
        ProjectFixtures.writeStandardStore(store, 2, 1);

        // Act
        List<ScenarioStats> stats = repository.findAll(project(store, 1, 2));

        // Assert
        assertThat(stats).extracting(ScenarioStats::getScenarioId).containsExactly(1, 2);
        ScenarioStats first = stats.get(0);
        assertThat(first.getTotalCoolingLoad()).isEqualTo(100000.0);
        assertThat(first.getAvgCoolingLoad()).isCloseTo(100000.0 / 8760, within(1e-9));
        assertThat(first.getTotalEnergyCost()).isEqualTo(1001.0);
        assertThat(first.getTotalElectricityDemand()).isEqualTo(5001.0);
        assertThat(first.getPeakCoolingLoad()).isEqualTo(5.0);
        assertThat(first.getPeakElectricLoad()).isEqualTo(3.5);
        assertThat(first.isTimeseriesUnavailable()).isFalse();
    }

    @Test
    @DisplayName("Scenarios without an hourly file are flagged")
    void findAll_flagsMissingTimeseries() throws Exception {
        Path store = dir.resolve("store.sqlite");
        ProjectFixtures.writeStandardStore(store, 1, 2, 3);

        List<ScenarioStats> stats = repository.findAll(project(store, 1, 3));

        assertThat(stats).extracting(ScenarioStats::isTimeseriesUnavailable).containsExactly(false, true, false);
    }

    @Test
    @DisplayName("Null cells and missing optional columns come back as null")
    void findAll_nullsAndMissingColumns() throws Exception {
        Path store = dir.resolve("store.sqlite");
        ProjectFixtures.writeStore(store,
                "CREATE TABLE OperationResult_RefYear (id_scenario INTEGER, Q_RoomCooling REAL, TotalCost REAL)",
                "INSERT INTO OperationResult_RefYear VALUES (1, NULL, 12.5)",
                "INSERT INTO OperationResult_RefYear VALUES (2, 8760, NULL)");

        List<ScenarioStats> stats = repository.findAll(project(store));

        assertThat(stats).hasSize(2);
        assertThat(stats.get(0).getTotalCoolingLoad()).isNull();
        assertThat(stats.get(0).getAvgCoolingLoad()).isNull();
        assertThat(stats.get(0).getTotalEnergyCost()).isEqualTo(12.5);
        assertThat(stats.get(0).getPeakElectricLoad()).isNull();
        assertThat(stats.get(1).getAvgCoolingLoad()).isEqualTo(1.0);
        assertThat(stats.get(1).getTotalElectricityDemand()).isNull();
        assertThat(stats.get(1).isTimeseriesUnavailable()).isTrue();
    }

    @Test
    @DisplayName("Numeric text is accepted and duplicate scenario rows keep the first")
    void findAll_textNumbersAndDuplicates() throws Exception {
        Path store = dir.resolve("store.sqlite");
        ProjectFixtures.writeStore(store,
                "CREATE TABLE OperationResult_RefYear (ID_Scenario, TotalCost)",
                "INSERT INTO OperationResult_RefYear VALUES (1, ' 42.5 ')",
                "INSERT INTO OperationResult_RefYear VALUES (1, 99)");

        List<ScenarioStats> stats = repository.findAll(project(store));

        assertThat(stats).hasSize(1);
        assertThat(stats.get(0).getTotalEnergyCost()).isEqualTo(42.5);
    }

    @Test
    @DisplayName("Non-numeric KPI values are reported as corrupt data")
    void findAll_nonNumericValue() throws Exception {
        Path store = dir.resolve("store.sqlite");
        ProjectFixtures.writeStore(store,
                "CREATE TABLE OperationResult_RefYear (ID_Scenario INTEGER, TotalCost TEXT)",
                "INSERT INTO OperationResult_RefYear VALUES (1, 'n/a')");

        assertThatThrownBy(() -> repository.findAll(project(store)))
                .isInstanceOf(DataCorruptException.class)
                .hasMessageContaining("TotalCost");
    }

    @Test
    @DisplayName("Scenario ids outside the int range or negative are corrupt")
    void findAll_outOfRangeScenarioId() throws Exception {
        Path tooLarge = dir.resolve("large.sqlite");
        ProjectFixtures.writeStore(tooLarge,
                "CREATE TABLE OperationResult_RefYear (ID_Scenario INTEGER, TotalCost REAL)",
                "INSERT INTO OperationResult_RefYear VALUES (4294967297, 1.0)");
        Path negative = dir.resolve("negative.sqlite");
        ProjectFixtures.writeStore(negative,
                "CREATE TABLE OperationResult_RefYear (ID_Scenario INTEGER, TotalCost REAL)",
                "INSERT INTO OperationResult_RefYear VALUES (-1, 1.0)");

        assertThatThrownBy(() -> repository.findAll(project(tooLarge)))
                .isInstanceOf(DataCorruptException.class)
                .hasMessageContaining("ID_Scenario");
        assertThatThrownBy(() -> repository.findAll(project(negative)))
                .isInstanceOf(DataCorruptException.class)
                .hasMessageContaining("ID_Scenario");
    }

    @Test
    @DisplayName("A store without the yearly table or scenario id column is corrupt")
    void findAll_missingTableOrIdColumn() throws Exception {
        Path noTable = dir.resolve("empty.sqlite");
        ProjectFixtures.writeStore(noTable, "CREATE TABLE other (x INTEGER)");
        Path noId = dir.resolve("noid.sqlite");
        ProjectFixtures.writeStore(noId, "CREATE TABLE OperationResult_RefYear (TotalCost REAL)",
                "INSERT INTO OperationResult_RefYear VALUES (1.0)");

        assertThatThrownBy(() -> repository.findAll(project(noTable)))
                .isInstanceOf(DataCorruptException.class)
                .hasMessageContaining("OperationResult_RefYear");
        assertThatThrownBy(() -> repository.findAll(project(noId)))
                .isInstanceOf(DataCorruptException.class)
                .hasMessageContaining("ID_Scenario");
    }

    @Test
    @DisplayName("An empty table yields no scenarios")
    void findAll_emptyTable() throws Exception {
        Path store = dir.resolve("store.sqlite");
        ProjectFixtures.writeStandardStore(store);

        assertThat(repository.findAll(project(store))).isEmpty();
    }

    @Test
    @DisplayName("Reading never modifies the store")
    void findAll_readOnly() throws Exception {
        Path store = dir.resolve("store.sqlite");
        ProjectFixtures.writeStandardStore(store, 1);
        long before = store.toFile().lastModified();
        long sizeBefore = store.toFile().length();

        repository.findAll(project(store, 1));

        assertThat(store.toFile().length()).isEqualTo(sizeBefore);
        assertThat(store.toFile().lastModified()).isEqualTo(before);
    }
}
