package com.astroinsight.astroinsight_backend.model.code;

import java.util.List;

public record DatasetInfo(String name, String path, List<String> columns) {

    public DatasetInfo {
        columns = columns != null ? List.copyOf(columns) : List.of();
    }
}
