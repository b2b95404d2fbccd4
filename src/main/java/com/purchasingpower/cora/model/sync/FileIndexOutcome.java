package com.purchasingpower.cora.model.sync;

public enum FileIndexOutcome {

    /** A new file version was written and published. */
    INDEXED,

    /** Content hash equals the latest version's; nothing was written. */
    UNCHANGED,

    /** Content matches an older stored version, which became the latest again. */
    REPUBLISHED,

    /** The file is gone; its path no longer has a latest version. */
    RETIRED,

    /** Not indexable: too large, binary, or missing and never indexed. */
    SKIPPED,

    /** Writing failed after retries; the previous version stays authoritative. */
    FAILED
}
