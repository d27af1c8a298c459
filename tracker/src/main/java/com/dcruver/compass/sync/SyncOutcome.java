package com.dcruver.compass.sync;

public enum SyncOutcome {
    SUCCESS,
    /** Push found nothing staged; no commit was made. */
    NO_CHANGES,
    REMOTE_NOT_CONFIGURED,
    /** A git command exited non-zero and no fallback recovered it. */
    FAILED
}
