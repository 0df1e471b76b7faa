package org.carball.placement.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class PlacementAnalyzerConfig {
    private Path inputFile;
    private Path outputDirectory;
    private OutputFormat outputFormat;
    private String profileName;
    private Path thresholdsFile;
    private int preambleLines;
    private boolean verbose;
    private BlockingThresholds thresholds;
}
