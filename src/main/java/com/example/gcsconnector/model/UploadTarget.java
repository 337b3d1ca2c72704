package com.example.gcsconnector.model;

import java.time.Duration;
import java.util.Map;

/**
 * One configured output: where finished segments of a stream end up.
 *
 * @param output           the locator exactly as configured, options included
 * @param bucket           destination bucket
 * @param blobPath         key prefix inside the bucket, empty when files go to the bucket root
 * @param filenameTemplate last path segment of the locator, may carry strftime placeholders
 * @param prefix           local file name prefix of the segments belonging to this output
 * @param interval         poll interval of the uploader
 * @param timeout          abandonment threshold, null when files are retried forever
 * @param options          the {@code !key=value} modifiers of the locator
 */
public record UploadTarget(
        String output,
        String bucket,
        String blobPath,
        String filenameTemplate,
        String prefix,
        Duration interval,
        Duration timeout,
        Map<String, String> options) {

    public static final String SCHEME = "gs://";

    /**
     * The locator without its options.
     */
    public String location() {
        return SCHEME + bucket + "/" + blobKey(filenameTemplate);
    }

    public String blobKey(String filename) {
        return blobPath.isEmpty() ? filename : blobPath + "/" + filename;
    }
}
