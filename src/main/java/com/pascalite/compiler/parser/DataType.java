package com.pascalite.compiler.parser;

import java.util.Locale;

/** Declarable value types. */
public enum DataType {
    INTEGER,
    REAL,
    BOOLEAN,
    STRING;

    public boolean isNumeric() {
        return this == INTEGER || this == REAL;
    }

    /** Spelling used in source code and in program listings. */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DataType fromKeyword(String keyword) {
        for (DataType t : values()) {
            if (t.keyword().equalsIgnoreCase(keyword)) return t;
        }
        throw new IllegalArgumentException("Unknown type: " + keyword);
    }
}
