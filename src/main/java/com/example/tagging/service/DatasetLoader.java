package com.example.tagging.service;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.DatasetEntry;
import com.example.tagging.model.EventRecord;
import com.example.tagging.model.GroundTruthRecord;
import com.example.tagging.registry.TagNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads labeled evaluation datasets from the data directory.
 * <p>
 * Expected columns: {@code ArrangementNummer}, {@code ArrangementTitel}, {@code arrangør},
 * {@code nc_Teaser}, {@code CleanText}, {@code ArrangementUndertype} and the reference tags
 * in {@code Underkategori1..3}, highest priority first. Rows without a title or without any
 * reference tag are skipped.
 */
@Service
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    private final Path dataDir;
    private final String defaultDataset;

    public DatasetLoader(TaggingProperties properties) {
        this.dataDir = Path.of(properties.data().dir()).toAbsolutePath().normalize();
        this.defaultDataset = properties.data().testDataset();
    }

    /**
     * @param datasetName file name under the data directory; null or blank selects the test dataset
     * @throws DatasetException if the file is outside the data directory, missing or unreadable
     */
    public List<DatasetEntry> load(String datasetName) {
        String name = datasetName == null || datasetName.isBlank() ? defaultDataset : datasetName.strip();
        Path file = dataDir.resolve(name).normalize();
        if (!file.startsWith(dataDir)) {
            throw new DatasetException("Dataset must be inside the data directory: " + name);
        }
        if (!Files.isRegularFile(file)) {
            throw new DatasetException("Dataset not found: " + name);
        }

        List<Map<String, String>> rows;
        try {
            rows = CsvTableReader.read(file);
        } catch (IOException e) {
            throw new DatasetException("Unable to read dataset " + name + ": " + e.getMessage(), e);
        }

        List<DatasetEntry> entries = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            String id = CsvTableReader.value(row, "ArrangementNummer");
            String title = CsvTableReader.value(row, "ArrangementTitel");

            List<String> tags = new ArrayList<>(3);
            for (int j = 1; j <= 3; j++) {
                String tag = TagNames.normalize(CsvTableReader.value(row, "Underkategori" + j));
                if (tag != null && !tags.contains(tag)) {
                    tags.add(tag);
                }
            }
            if (title.isEmpty() || tags.isEmpty()) {
                log.debug("Skipping dataset row {}: title or reference tags missing", i);
                continue;
            }

            EventRecord event = new EventRecord(id, title,
                    CsvTableReader.value(row, "arrangør", "Arrangør", "arrangor"),
                    CsvTableReader.value(row, "ArrangementUndertype"),
                    CsvTableReader.value(row, "nc_Teaser"),
                    CsvTableReader.value(row, "CleanText", "nc_Beskrivelse"),
                    CsvTableReader.value(row, "BeskrivelseHTMLfri"));
            entries.add(new DatasetEntry(event, new GroundTruthRecord(id, tags)));
        }
        log.info("Loaded {} labeled events from {} ({} rows skipped)", entries.size(), file, rows.size() - entries.size());
        return entries;
    }
}
