package org.carball.placement.config;

public enum OutputFormat {
    TEXT,
    JSON,
    BOTH
}
