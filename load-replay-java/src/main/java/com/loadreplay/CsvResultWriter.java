package com.loadreplay;

import com.opencsv.CSVWriter;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * CSV output of the individual responses of a replay.
 */
public class CsvResultWriter {

    private static final String[] HEADERS = {
            "path", "status", "latency_ms", "error"
    };

    /**
     * Writes one row per response. If {@code outputPath} does not end in {@code .csv} it is
     * treated as a directory and a timestamped file name is generated inside it.
     *
     * @return the path of the written file
     */
    public static String saveResults(List<ReplayResponse> responses, String outputPath) throws IOException {
        String filepath;
        if (outputPath.endsWith(".csv")) {
            filepath = outputPath;
            Path parent = Paths.get(outputPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } else {
            Path dir = Paths.get(outputPath);
            Files.createDirectories(dir);
            String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss"));
            filepath = dir.resolve(timestamp + "_replay.csv").toString();
        }

        try (CSVWriter writer = new CSVWriter(new FileWriter(filepath, StandardCharsets.UTF_8))) {
            writer.writeNext(HEADERS);
            for (ReplayResponse response : responses) {
                writer.writeNext(new String[] {
                        response.getPath(),
                        String.valueOf(response.getStatus()),
                        String.valueOf(response.getLatencyMillis()),
                        response.getError() != null ? response.getError() : ""
                });
            }
        }

        return filepath;
    }
}
