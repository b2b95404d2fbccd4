package com.purchasingpower.cora.model.index;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An indexed repository. Identity is immutable; the last indexed commit pointer moves forward
 * with every successful sync.
 */
@Value
@Builder(toBuilder = true)
public class RepositoryRef {

    String repoId;

    /** Origin location, e.g. a clone URL. */
    String originUri;

    /** Local checkout, absent for repositories only reachable through notifications. */
    String checkoutPath;

    /** Project directory inside the checkout; empty for the checkout root. */
    @Builder.Default
    String projectDir = "";

    String lastIndexedCommit;

    Instant lastIndexedAt;

    public boolean hasCheckout() {
        return checkoutPath != null && !checkoutPath.isBlank();
    }
}
