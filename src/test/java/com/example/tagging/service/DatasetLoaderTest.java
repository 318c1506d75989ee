package com.example.tagging.service;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.DatasetEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetLoaderTest {

    @TempDir
    Path dir;

    private DatasetLoader loader;

    @BeforeEach
    void setUp() {
        loader = new DatasetLoader(new TaggingProperties(
                new TaggingProperties.Data(dir.toString(), null, "test_set.csv"),
                null, null, null, null, null, null));
    }

    @Test
    void loadsDefaultDatasetAndSkipsIncompleteRows() throws IOException {
        write("test_set.csv", """
                ArrangementNummer;ArrangementTitel;arrangør;ArrangementUndertype;nc_Teaser;CleanText;Underkategori1;Underkategori2;Underkategori3
                A1;Fodboldskole;DBU;Kursus;Sommer;Lær fodbold;Sport;Kultur;
                A2;;DBU;Kursus;;;Sport;;
                A3;Tom;X;;;;;;
                A4;Madkursus;;;;;mad;Mad;
                """);

        List<DatasetEntry> entries = loader.load(null);

        assertThat(entries).hasSize(2);
        DatasetEntry first = entries.get(0);
        assertThat(first.event().id()).isEqualTo("A1");
        assertThat(first.event().title()).isEqualTo("Fodboldskole");
        assertThat(first.event().organizer()).isEqualTo("DBU");
        assertThat(first.event().subtype()).isEqualTo("Kursus");
        assertThat(first.event().teaser()).isEqualTo("Sommer");
        assertThat(first.event().description()).isEqualTo("Lær fodbold");
        assertThat(first.groundTruth().tags()).containsExactly("SPORT", "KULTUR");
        assertThat(entries.get(1).groundTruth().tags()).containsExactly("MAD");
    }

    @Test
    void loadsNamedCommaSeparatedDataset() throws IOException {
        write("other.csv", """
                ArrangementNummer,ArrangementTitel,Underkategori1
                9,"Koncert, jazz",Musik
                """);

        List<DatasetEntry> entries = loader.load("other.csv");

        assertThat(entries).singleElement()
                .satisfies(e -> assertThat(e.event().title()).isEqualTo("Koncert, jazz"));
    }

    @Test
    void rowWithExtraFieldsIsSkippedWithoutDroppingTheFile() throws IOException {
        write("test_set.csv", """
                ArrangementNummer;ArrangementTitel;Underkategori1
                A1;Fodboldskole;Sport
                A2;Koncert;Musik;extra
                A3;Madkursus;Mad
                """);

        List<DatasetEntry> entries = loader.load(null);

        assertThat(entries).extracting(e -> e.event().id()).containsExactly("A1", "A3");
        assertThat(entries.get(1).groundTruth().tags()).containsExactly("MAD");
    }

    @Test
    void trailingEmptyFieldsDoNotCountAsExtra() throws IOException {
        write("test_set.csv", """
                ArrangementNummer;ArrangementTitel;Underkategori1
                A1;Fodboldskole;Sport;;
                """);

        assertThat(loader.load(null)).singleElement()
                .satisfies(e -> assertThat(e.groundTruth().tags()).containsExactly("SPORT"));
    }

    @Test
    void missingDatasetIsReported() {
        assertThatThrownBy(() -> loader.load("missing.csv"))
                .isInstanceOf(DatasetException.class)
                .hasMessage("Dataset not found: missing.csv");
    }

    @Test
    void rejectsPathsOutsideDataDirectory() {
        assertThatThrownBy(() -> loader.load("../outside.csv"))
                .isInstanceOf(DatasetException.class)
                .hasMessageContaining("inside the data directory");
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
