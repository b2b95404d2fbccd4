package com.purchasingpower.cora.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RepositoryContext {

    String repoId;

    @Singular
    List<FileContext> files;
}
