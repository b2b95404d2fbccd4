package com.purchasingpower.cora.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Forces one declaration into the response.
 *
 * {@code path} is {@code <filePath>#<identifier>} or a bare identifier. With
 * {@code includeImplementation} the defining chunk is rendered in full, otherwise only the
 * declaration's first line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeclarationBoost {

    private String repoId;
    private String path;

    @Builder.Default
    private boolean includeImplementation = true;

    public String identifier() {
        int hash = path.lastIndexOf('#');
        return hash < 0 ? path : path.substring(hash + 1);
    }

    /** File part of the path, null for a bare identifier. */
    public String filePath() {
        int hash = path.lastIndexOf('#');
        return hash <= 0 ? null : path.substring(0, hash);
    }
}
