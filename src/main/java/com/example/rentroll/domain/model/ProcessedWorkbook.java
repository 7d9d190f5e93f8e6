package com.example.rentroll.domain.model;

import java.util.Arrays;

/**
 * Processed workbook bytes together with the run summary.
 * The content is a fresh buffer and never replaces the uploaded source; it is copied on the way
 * in and out so callers cannot alter a cached result.
 */
public record ProcessedWorkbook(
        ProcessingResult result,
        byte[] content
) {
    public ProcessedWorkbook {
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String outputFileName() {
        return result.outputFileName();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ProcessedWorkbook that
                && result.equals(that.result)
                && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * result.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "ProcessedWorkbook[result=" + result + ", content=" + content.length + " bytes]";
    }
}
