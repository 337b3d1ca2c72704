package com.example.gcsconnector.model;

public enum UploadOutcome {
    /** Uploaded and removed from local disk. */
    UPLOADED,
    /** Upload failed, the file stays and is retried on the next cycle. */
    FAILED,
    /** Locked by a writer or gone before it could be uploaded. */
    SKIPPED,
    /** Failed past the configured timeout, left on disk and never retried. */
    ABANDONED
}
