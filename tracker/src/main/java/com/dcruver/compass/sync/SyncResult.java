package com.dcruver.compass.sync;

import lombok.Value;

/**
 * Result of one sync operation: the outcome, the step that failed (if any), and the
 * step-by-step transcript with git's raw output.
 */
@Value
public class SyncResult {
    SyncOutcome outcome;
    String failedStep;
    String transcript;

    public boolean isSuccess() {
        return outcome == SyncOutcome.SUCCESS || outcome == SyncOutcome.NO_CHANGES;
    }

    static SyncResult success(SyncTranscript transcript) {
        return new SyncResult(SyncOutcome.SUCCESS, null, transcript.toString());
    }

    static SyncResult noChanges(SyncTranscript transcript) {
        return new SyncResult(SyncOutcome.NO_CHANGES, null, transcript.toString());
    }

    static SyncResult remoteNotConfigured(SyncTranscript transcript) {
        return new SyncResult(SyncOutcome.REMOTE_NOT_CONFIGURED, "remote", transcript.toString());
    }

    static SyncResult failed(String step, SyncTranscript transcript) {
        return new SyncResult(SyncOutcome.FAILED, step, transcript.toString());
    }
}
