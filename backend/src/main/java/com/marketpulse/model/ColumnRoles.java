package com.marketpulse.model;

import lombok.Value;

import java.util.Optional;

/** Columns resolved for one pipeline run. Absent roles are empty, never null. */
@Value
public class ColumnRoles {
    Optional<String> textColumn;
    Optional<String> timeColumn;

    public static ColumnRoles none() {
        return new ColumnRoles(Optional.empty(), Optional.empty());
    }
}
