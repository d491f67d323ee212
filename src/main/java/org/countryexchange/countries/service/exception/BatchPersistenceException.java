package org.countryexchange.countries.service.exception;

/**
 * Thrown when a chunk upsert fails. Chunks before {@link #getFailedChunk()} are already committed;
 * the failed chunk and everything after it were not written.
 */
public class BatchPersistenceException extends ServiceException {

  private final int failedChunk;
  private final int totalChunks;
  private final int affectedBeforeFailure;

  public BatchPersistenceException(
      int failedChunk, int totalChunks, int affectedBeforeFailure, Throwable cause) {
    super(
        "Upsert failed on chunk "
            + failedChunk
            + " of "
            + totalChunks
            + " after "
            + affectedBeforeFailure
            + " affected rows",
        cause);
    this.failedChunk = failedChunk;
    this.totalChunks = totalChunks;
    this.affectedBeforeFailure = affectedBeforeFailure;
  }

  /** One-based index of the chunk that failed. */
  public int getFailedChunk() {
    return failedChunk;
  }

  public int getTotalChunks() {
    return totalChunks;
  }

  public int getAffectedBeforeFailure() {
    return affectedBeforeFailure;
  }
}
