package com.purchasingpower.cora.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ChunkingProperties chunking = new ChunkingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RankingProperties ranking = new RankingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private BudgetProperties budget = new BudgetProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StoreProperties store = new StoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CommentaryProperties commentary = new CommentaryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IndexingProperties indexing = new IndexingProperties();
}
