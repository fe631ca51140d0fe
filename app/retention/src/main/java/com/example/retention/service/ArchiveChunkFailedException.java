/*
 * Where: Retention archive
 * What: A chunk's insert or delete failed and its transaction was rolled back
 * Why: Callers need to know how much was already archived by earlier, committed chunks
 */
package com.example.retention.service;

public class ArchiveChunkFailedException extends RetentionException {

  private static final long serialVersionUID = 1L;

  private final long committedRows;

  public ArchiveChunkFailedException(String entityType, long committedRows, Throwable cause) {
    super(
        "archive chunk failed and was rolled back entityType="
            + entityType
            + " committedRows="
            + committedRows,
        cause);
    this.committedRows = committedRows;
  }

  public long committedRows() {
    return committedRows;
  }
}
