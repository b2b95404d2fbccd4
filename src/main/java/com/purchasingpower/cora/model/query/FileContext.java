package com.purchasingpower.cora.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Sections of one file version, in line order.
 */
@Value
@Builder
public class FileContext {

    String filePath;
    String fileVersionId;
    String language;

    @Singular
    List<ContextSection> sections;
}
