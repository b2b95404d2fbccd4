package com.purchasingpower.cora.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StoreProperties {

    /** {@code memory} or {@code neo4j}. */
    @NotBlank
    private String type = "memory";

    private String uri = "bolt://localhost:7687";

    private String username = "neo4j";

    private String password = "password";

    @Min(1)
    private int embeddingDimensions = 1024;
}
