package com.williamcallahan.docarchive.service.management;

/**
 * Outcome counts of one archiver run.
 *
 * @param archived documents that received a new archive version
 * @param skipped documents left untouched (no parser for the mime type, or archiving disabled)
 * @param failed documents whose archive could not be produced
 */
public record ArchiveRunSummary(int archived, int skipped, int failed) {
}
