package com.purchasingpower.cora.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class BudgetProperties {

    @NotBlank
    private String elisionMarker = "...";

    /** Characters an elided entry is assumed to cost (path, line range and marker). */
    @Min(0)
    private int elidedEntryChars = 80;

    /** Drop the lowest-ranked remainder once even elided entries no longer fit. */
    private boolean tailCutEnabled = true;
}
