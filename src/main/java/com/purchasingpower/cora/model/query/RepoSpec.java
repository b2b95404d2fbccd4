package com.purchasingpower.cora.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A repository to search, optionally pinned to a version.
 *
 * The version specifier is either a commit hash that was indexed, or an ISO-8601 instant. Without
 * one the repository is read at its latest versions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepoSpec {

    private String repoId;
    private String versionSpecifier;

    public static RepoSpec latest(String repoId) {
        return new RepoSpec(repoId, null);
    }

    public static RepoSpec at(String repoId, String versionSpecifier) {
        return new RepoSpec(repoId, versionSpecifier);
    }

    public boolean isPinned() {
        return versionSpecifier != null && !versionSpecifier.isBlank();
    }
}
