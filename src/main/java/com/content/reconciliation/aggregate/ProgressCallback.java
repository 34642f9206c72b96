package com.content.reconciliation.aggregate;

/**
 * Receives the running outcome of a chunked fold.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called once per chunk, after its records were applied.
     *
     * @param recordsSeen  records read so far, folded or rejected
     * @param recordsTotal records in the batch
     * @param soFar        counts and rejections up to and including this chunk
     */
    void onChunkFolded(int recordsSeen, int recordsTotal, FoldResult soFar);

    ProgressCallback NOOP = (recordsSeen, recordsTotal, soFar) -> { };
}
