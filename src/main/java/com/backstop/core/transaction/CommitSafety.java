package com.backstop.core.transaction;

public enum CommitSafety {
    SAFE,
    /** Commit is possible but the mutation may be lost if the host restores state. */
    ALLOW_LOSSY_COMMIT,
    UNSAFE
}
