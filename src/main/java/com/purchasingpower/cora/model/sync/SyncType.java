package com.purchasingpower.cora.model.sync;

/**
 * Kind of reindex pass that was performed.
 */
public enum SyncType {

    /** Every file of the checkout was visited; vanished paths were retired. */
    FULL_RESCAN,

    /** Specific paths were reindexed after a change notification. */
    NOTIFIED_PATHS,

    /** Reindex requested explicitly, bypassing the unchanged-content check. */
    FORCED_REFRESH,

    /** Only files changed between the last indexed commit and HEAD. */
    INCREMENTAL,

    /** HEAD is the last indexed commit. Nothing was done. */
    NO_CHANGES,

    /** The pass could not run. Check logs for details. */
    ERROR
}
