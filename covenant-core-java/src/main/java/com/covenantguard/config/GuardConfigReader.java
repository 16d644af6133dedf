package com.covenantguard.config;

import com.covenantguard.report.Severity;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

public class GuardConfigReader {

    public static final String DEFAULTS_RESOURCE = "/covenant-guard-defaults.json";

    private static final Gson GSON = new Gson();

    /**
     * Loads the bundled defaults, overlays {@code overridePath} if non-null, and validates the result.
     *
     * @throws ConfigReadException if either file is missing, malformed or inconsistent
     */
    public GuardSettings load(Path overridePath) {
        GuardConfig config = readDefaults();
        if (overridePath != null) {
            config = config.merge(read(overridePath));
            System.err.println("[covenant-guard] Config overrides applied from " + overridePath);
        }
        return resolve(config);
    }

    public GuardConfig readDefaults() {
        InputStream in = GuardConfigReader.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            throw new ConfigReadException("Bundled defaults not found on classpath: " + DEFAULTS_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read " + DEFAULTS_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads and deserializes a config file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public GuardConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            return parse(reader, configPath.toString());
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    private GuardConfig parse(Reader reader, String origin) {
        GuardConfig config;
        try {
            config = GSON.fromJson(reader, GuardConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty or invalid JSON: " + origin);
        }
        return config;
    }

    /** Validates a merged config and converts it to immutable settings. */
    public GuardSettings resolve(GuardConfig config) {
        Map<String, RuleSpec> rules = new LinkedHashMap<>();
        for (Map.Entry<String, GuardConfig.RuleEntry> e : config.getRules().entrySet()) {
            GuardConfig.RuleEntry entry = e.getValue();
            if (entry == null) {
                throw new ConfigReadException("Rule " + e.getKey() + " has no definition");
            }
            if (entry.category == null || entry.category.isBlank()) {
                throw new ConfigReadException("Rule " + e.getKey() + " has no category");
            }
            rules.put(e.getKey(), new RuleSpec(e.getKey(), severity(e.getKey(), entry.severity),
                    entry.category, nullToEmpty(entry.exploit), nullToEmpty(entry.fixHint), nullToEmpty(entry.pattern)));
        }

        Map<Severity, Integer> penalties = new EnumMap<>(Severity.class);
        for (Map.Entry<String, Integer> e : config.getPenalties().entrySet()) {
            penalties.put(severity("penalties", e.getKey()), e.getValue());
        }

        GuardConfig.EscalationEntry esc = config.getEscalation();
        if (config.getBaselineScore() == null || config.getSoftFailBudget() == null
                || esc == null || esc.minimalThroughAttempt == null || esc.expandedThroughAttempt == null) {
            throw new ConfigReadException("Config is missing baseline_score, soft_fail_budget or escalation thresholds");
        }

        try {
            ScoringPolicy scoring = new ScoringPolicy(penalties, config.getBaselineScore(),
                    config.getSoftFailBudget(), new LinkedHashSet<>(config.getBlockingCategories()));
            EscalationPolicy escalation = new EscalationPolicy(esc.minimalThroughAttempt, esc.expandedThroughAttempt);
            return new GuardSettings(new RuleTable(rules), scoring, escalation);
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException("Invalid config: " + e.getMessage(), e);
        }
    }

    private static Severity severity(String owner, String value) {
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException("Unknown severity '" + value + "' in " + owner, e);
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
