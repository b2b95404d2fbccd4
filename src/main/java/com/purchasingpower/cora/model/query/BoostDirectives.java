package com.purchasingpower.cora.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoostDirectives {

    /** File paths whose latest version is included whole. */
    @Singular
    private List<String> files;

    @Singular
    private List<DeclarationBoost> declarations;

    public static BoostDirectives none() {
        return BoostDirectives.builder().build();
    }

    public boolean isEmpty() {
        return (files == null || files.isEmpty()) && (declarations == null || declarations.isEmpty());
    }
}
