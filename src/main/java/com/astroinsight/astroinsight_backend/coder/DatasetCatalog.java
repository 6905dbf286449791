package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only view of the dataset directory.
 *
 * Every {@code .csv} / {@code .tsv} file (two levels deep) is a dataset; its name is the file name
 * without extension and its columns come from the first non-comment line. The directory is
 * rescanned on every call so datasets can be dropped in without a restart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetCatalog {

    private static final int SCAN_DEPTH = 2;

    private final AgentProperties properties;

    public List<DatasetInfo> list() {
        Path root = Paths.get(properties.getCoder().getDatasetDir());
        if (!Files.isDirectory(root)) {
            log.warn("Dataset directory {} does not exist", root.toAbsolutePath());
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root, SCAN_DEPTH)) {
            return walk.filter(Files::isRegularFile)
                    .filter(DatasetCatalog::isTabular)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(this::describe)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to scan dataset directory {}: {}", root, e.getMessage());
            return List.of();
        }
    }

    /** Numbered summary used by the selection prompt; numbering is 1-based. */
    public static String summary(List<DatasetInfo> datasets) {
        if (datasets.isEmpty()) return "No datasets available.";
        StringBuilder sb = new StringBuilder("Available datasets:\n");
        for (int i = 0; i < datasets.size(); i++) {
            DatasetInfo d = datasets.get(i);
            sb.append(i + 1).append(". ").append(d.name()).append('\n');
            sb.append("   path: ").append(d.path()).append('\n');
            sb.append("   columns (").append(d.columns().size()).append("): ")
              .append(abbreviate(d.columns(), 5)).append("\n\n");
        }
        return sb.toString();
    }

    static String abbreviate(List<String> columns, int max) {
        if (columns.size() <= max) return String.join(", ", columns);
        return String.join(", ", columns.subList(0, max)) + ", ...";
    }

    private DatasetInfo describe(Path file) {
        String fileName = file.getFileName().toString();
        String name = fileName.substring(0, fileName.lastIndexOf('.'));
        return new DatasetInfo(name, file.toAbsolutePath().toString(), readColumns(file));
    }

    private List<String> readColumns(Path file) {
        char separator = file.toString().toLowerCase(Locale.ROOT).endsWith(".tsv") ? '\t' : ',';
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                List<String> columns = new ArrayList<>();
                Arrays.stream(trimmed.split(separator == '\t' ? "\t" : ","))
                        .map(c -> c.strip().replaceAll("^\"|\"$", ""))
                        .filter(c -> !c.isEmpty())
                        .forEach(columns::add);
                return columns;
            }
        } catch (IOException e) {
            log.warn("Cannot read header of {}: {}", file, e.getMessage());
        }
        return List.of();
    }

    private static boolean isTabular(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") || name.endsWith(".tsv");
    }
}
