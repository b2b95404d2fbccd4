package com.purchasingpower.cora.query;

import java.util.List;

/**
 * Slices forced into the response by one boost directive, kept together in line order.
 *
 * @param directive the directive as written, for logs
 */
public record BoostedUnit(String directive, List<ContextSlice> slices) {

    public int length() {
        return slices.stream().mapToInt(ContextSlice::length).sum();
    }
}
