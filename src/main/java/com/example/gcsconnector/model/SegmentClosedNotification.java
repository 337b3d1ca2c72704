package com.example.gcsconnector.model;

/**
 * Sent by the upstream sink once a segment file is finalized.
 *
 * @param output full locator, locator without options, or zero-based index of the output;
 *               may be omitted when only one output is configured
 * @param path   local path of the closed segment file
 */
public record SegmentClosedNotification(String output, String path) {
}
