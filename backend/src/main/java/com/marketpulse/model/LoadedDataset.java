package com.marketpulse.model;

import lombok.Value;

import java.time.Instant;

/** The dataset currently under analysis: normalized, classified and with its column roles resolved. */
@Value
public class LoadedDataset {
    String fileName;
    Instant loadedAt;
    RecordTable table;
    ColumnRoles roles;

    /** Key identifying this load; a re-load of the same file gets a new one. */
    public String cacheKey() {
        return fileName + "@" + loadedAt.toEpochMilli();
    }
}
