package com.covenantguard.report;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

public enum Severity {
    @SerializedName("critical") CRITICAL,
    @SerializedName("high")     HIGH,
    @SerializedName("medium")   MEDIUM,
    @SerializedName("low")      LOW,
    @SerializedName("info")     INFO;

    /** Critical and high findings may block on their own; lower ones only count toward the soft budget. */
    public boolean isBlockingGrade() {
        return this == CRITICAL || this == HIGH;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for anything but the five lowercase or uppercase names
     */
    public static Severity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("severity is missing");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
