package com.astroinsight.astroinsight_backend.coder;

import com.astroinsight.astroinsight_backend.config.AgentProperties;
import com.astroinsight.astroinsight_backend.model.code.DatasetInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Dataset catalog")
class DatasetCatalogTest {

    @TempDir
    Path datasetDir;

    private DatasetCatalog catalogFor(Path dir) {
        AgentProperties properties = new AgentProperties();
        properties.getCoder().setDatasetDir(dir.toString());
        return new DatasetCatalog(properties);
    }

    @Test
    @DisplayName("CSV and TSV files are listed by name with their header columns")
    void listsTabularFiles() throws Exception {
        // Given
        Files.writeString(datasetDir.resolve("stars.csv"), "# Gaia extract\nra,dec,\"phot_g_mean_mag\"\n1,2,3\n");
        Files.createDirectories(datasetDir.resolve("sub"));
        Files.writeString(datasetDir.resolve("sub").resolve("galaxies.tsv"), "z\ttype\n0.1\tSa\n");
        Files.writeString(datasetDir.resolve("notes.txt"), "not a dataset");

        // When
        List<DatasetInfo> datasets = catalogFor(datasetDir).list();

        // Then
        assertThat(datasets).extracting(DatasetInfo::name).containsExactly("galaxies", "stars");
        assertThat(datasets.get(1).columns()).containsExactly("ra", "dec", "phot_g_mean_mag");
        assertThat(datasets.get(0).columns()).containsExactly("z", "type");
        assertThat(datasets.get(1).path()).isEqualTo(datasetDir.resolve("stars.csv").toAbsolutePath().toString());
    }

    @Test
    @DisplayName("A missing directory is an empty catalog")
    void missingDirectory() {
        assertThat(catalogFor(datasetDir.resolve("absent")).list()).isEmpty();
    }

    @Test
    @DisplayName("Summary numbers datasets from 1 and abbreviates long column lists")
    void summary() {
        DatasetInfo wide = new DatasetInfo("wide", "/d/wide.csv", List.of("a", "b", "c", "d", "e", "f"));

        String summary = DatasetCatalog.summary(List.of(wide));

        assertThat(summary).contains("1. wide").contains("columns (6): a, b, c, d, e, ...");
        assertThat(DatasetCatalog.summary(List.of())).isEqualTo("No datasets available.");
    }
}
