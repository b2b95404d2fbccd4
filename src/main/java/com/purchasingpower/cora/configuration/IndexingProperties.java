package com.purchasingpower.cora.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class IndexingProperties {

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 500;

    /** Files larger than this are skipped during rescans. */
    @Min(1)
    private long maxFileBytes = 1_000_000;

    /** Glob patterns (relative to the project directory) a rescan includes; empty means all. */
    private List<String> include = new ArrayList<>();

    private List<String> exclude = new ArrayList<>(List.of(
            "**/.git/**", "**/node_modules/**", "**/target/**", "**/build/**", "**/dist/**"));
}
