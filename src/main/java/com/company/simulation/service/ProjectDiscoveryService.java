package com.company.simulation.service;

import com.company.simulation.config.SimulationProperties;
import com.company.simulation.domain.ProjectInfo;
import com.company.simulation.domain.ScenarioFile;
import com.company.simulation.exception.DataCorruptException;
import com.company.simulation.exception.DataReadFailureException;
import com.company.simulation.exception.ProjectNotFoundException;
import com.company.simulation.exception.ScenarioNotFoundException;
import com.company.simulation.util.ProjectFolderNames;
import com.company.simulation.util.ProjectFolderNames.ProjectName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the project catalog from the file system on every call.
 *
 * <p>Listing only looks at names and file attributes. Scenario files are opened
 * later, by the readers, once a scenario is actually requested.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProjectDiscoveryService {

    static final String OUTPUT_DIR = "output";

    private final SimulationProperties properties;

    public List<ProjectInfo> listProjects() {
        Path root = projectsRoot();
        if (!Files.isDirectory(root)) {
            log.warn("Projects root {} does not exist or is not a directory", root);
            return Collections.emptyList();
        }

        List<Path> folders = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
            stream.forEach(folders::add);
        } catch (IOException e) {
            throw new DataReadFailureException("Failed to list projects root " + root, e);
        }
        folders.sort(null);

        List<ProjectInfo> projects = new ArrayList<>();
        for (Path folder : folders) {
            buildProject(folder).ifPresent(projects::add);
        }

        log.debug("Discovered {} projects under {}", projects.size(), root);
        return projects;
    }

    public ProjectInfo findProject(String projectId) {
        if (ProjectFolderNames.parseProjectFolder(projectId).isEmpty()) {
            throw new ProjectNotFoundException(projectId);
        }
        Path folder = projectsRoot().resolve(projectId);
        if (!Files.isDirectory(folder)) {
            throw new ProjectNotFoundException(projectId);
        }
        return buildProject(folder).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    /**
     * Resolves and validates the hourly file of a scenario on first use.
     */
    public ScenarioFile requireReadableScenarioFile(ProjectInfo project, int scenarioId) {
        Path file = project.scenarioFile(scenarioId)
                .orElseThrow(() -> new ScenarioNotFoundException(project.getId(), scenarioId));

        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new DataReadFailureException("Scenario file is missing or unreadable: " + file);
        }
        try {
            if (Files.size(file) == 0) {
                throw new DataCorruptException("Scenario file is empty: " + file);
            }
        } catch (IOException e) {
            throw new DataReadFailureException("Failed to inspect scenario file " + file, e);
        }
        return new ScenarioFile(project.getId(), scenarioId, file);
    }

    private Optional<ProjectInfo> buildProject(Path folder) {
        String projectId = folder.getFileName().toString();
        Optional<ProjectName> parsed = ProjectFolderNames.parseProjectFolder(projectId);
        if (parsed.isEmpty()) {
            log.debug("Skipping non-project folder {}", folder);
            return Optional.empty();
        }

        Path outputDir = folder.resolve(OUTPUT_DIR);
        if (!Files.isDirectory(outputDir)) {
            log.warn("Excluding project {}: output directory {} is missing", projectId, outputDir);
            return Optional.empty();
        }

        List<Path> files;
        try {
            files = listFiles(outputDir);
        } catch (IOException e) {
            log.warn("Excluding project {}: cannot list {}: {}", projectId, outputDir, e.getMessage());
            return Optional.empty();
        }

        Optional<Path> store = selectStore(projectId, files);
        if (store.isEmpty()) {
            log.warn("Excluding project {}: no readable relational store in {}", projectId, outputDir);
            return Optional.empty();
        }

        ProjectName name = parsed.get();
        return Optional.of(ProjectInfo.builder()
                .id(projectId)
                .name(name.displayName())
                .country(name.getCountry())
                .year(name.getYear())
                .focus(name.getFocus())
                .path(folder)
                .outputDir(outputDir)
                .storePath(store.get())
                .scenarioFiles(scenarioFiles(projectId, files))
                .build());
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            stream.forEach(files::add);
        }
        files.sort(null);
        return files;
    }

    private static Optional<Path> selectStore(String projectId, List<Path> files) {
        String preferred = projectId + ProjectFolderNames.STORE_SUFFIX;
        Optional<Path> exact = files.stream()
                .filter(file -> file.getFileName().toString().equals(preferred))
                .filter(Files::isReadable)
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return files.stream()
                .filter(file -> ProjectFolderNames.isStoreFile(file.getFileName().toString()))
                .filter(Files::isReadable)
                .findFirst();
    }

    private static SortedMap<Integer, Path> scenarioFiles(String projectId, List<Path> files) {
        SortedMap<Integer, Path> scenarios = new TreeMap<>();
        Set<Integer> ambiguous = new HashSet<>();

        for (Path file : files) {
            OptionalInt scenarioId = ProjectFolderNames.parseScenarioId(file.getFileName().toString());
            if (scenarioId.isEmpty()) {
                continue;
            }
            Path previous = scenarios.putIfAbsent(scenarioId.getAsInt(), file);
            if (previous != null) {
                ambiguous.add(scenarioId.getAsInt());
            }
        }

        for (Integer scenarioId : ambiguous) {
            scenarios.remove(scenarioId);
            log.warn("Excluding scenario {} of project {}: more than one hourly file matches", scenarioId, projectId);
        }
        return Collections.unmodifiableSortedMap(scenarios);
    }

    private Path projectsRoot() {
        return properties.projectsRootPath();
    }
}
