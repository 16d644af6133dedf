package com.covenantguard.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link CheckReport} to check_report.json. The report carries no
 * timestamps, so identical runs produce byte-identical files.
 */
public class ReportWriter {

    public static final String REPORT_FILE = "check_report.json";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code report} to {@code outputDir/check_report.json}.
     *
     * @param outputDir directory to write into (created if absent)
     * @return path of the written file
     */
    public Path write(CheckReport report, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }

        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            GSON.toJson(report, w);
            w.write("\n");
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[covenant-guard] " + REPORT_FILE + " written: " + reportPath);
        return reportPath;
    }

    public String toJson(CheckReport report) {
        return GSON.toJson(report);
    }

    public static CheckReport fromJson(String json) {
        return GSON.fromJson(json, CheckReport.class);
    }
}
