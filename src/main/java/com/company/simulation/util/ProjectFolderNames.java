package com.company.simulation.util;

import lombok.Value;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the on-disk naming conventions of project folders and scenario files.
 */
public final class ProjectFolderNames {

    private static final Pattern PROJECT_FOLDER =
            Pattern.compile("^([A-Z]{2,3})_(\\d{4})_([A-Za-z0-9][A-Za-z0-9_-]*)$");

    private static final Pattern SCENARIO_FILE =
            Pattern.compile("^OperationResult_RefHour_S(\\d{1,9})\\.parquet\\.gzip$", Pattern.CASE_INSENSITIVE);

    public static final String STORE_SUFFIX = ".sqlite";

    private ProjectFolderNames() {
    }

    public static Optional<ProjectName> parseProjectFolder(String folderName) {
        if (folderName == null) {
            return Optional.empty();
        }
        Matcher matcher = PROJECT_FOLDER.matcher(folderName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ProjectName(
                matcher.group(1), Integer.parseInt(matcher.group(2)), matcher.group(3)));
    }

    public static OptionalInt parseScenarioId(String fileName) {
        if (fileName == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = SCENARIO_FILE.matcher(fileName);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(matcher.group(1)));
    }

    public static boolean isStoreFile(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(STORE_SUFFIX);
    }

    @Value
    public static class ProjectName {
        String country;
        int year;
        String focus;

        /**
         * Display name, e.g. {@code AUT 2020 Cooling}.
         */
        public String displayName() {
            String label = focus.substring(0, 1).toUpperCase(Locale.ROOT) + focus.substring(1);
            return country + " " + year + " " + label;
        }
    }
}
