package com.example.rentroll.domain.model;

/**
 * Stages of a processing run in execution order, with the progress reached when each starts.
 */
public enum ProcessingStage {
    DETECTING_STRUCTURE("Detecting structure", 25),
    EXTRACTING_CHARGES("Extracting charges", 50),
    APPENDING_DATA("Appending extracted data", 75),
    ADJUSTING_COLUMNS("Adjusting and highlighting columns", 90);

    private final String label;
    private final int progressPercent;

    ProcessingStage(String label, int progressPercent) {
        this.label = label;
        this.progressPercent = progressPercent;
    }

    public String label() {
        return label;
    }

    public int progressPercent() {
        return progressPercent;
    }
}
