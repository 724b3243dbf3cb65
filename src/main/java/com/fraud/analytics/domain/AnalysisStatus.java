package com.fraud.analytics.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisStatus {
    OK("ok"),
    NO_VALID_RECORDS("no_valid_records");

    private final String code;

    AnalysisStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static AnalysisStatus fromCode(String code) {
        for (AnalysisStatus s : values()) {
            if (s.code.equals(code)) return s;
        }
        throw new IllegalArgumentException("Unknown analysis status: " + code);
    }
}
