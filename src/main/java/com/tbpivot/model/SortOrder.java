package com.tbpivot.model;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromString(String value) {
        if (value != null && "DESC".equals(value.trim().toUpperCase(Locale.ROOT))) {
            return DESC;
        }
        return ASC;
    }
}
