package com.example.retention.service;

/** The archive table cannot receive rows; raised before any row is touched. */
public class ArchiveDestinationException extends RetentionException {

  private static final long serialVersionUID = 1L;

  private final String archiveTable;

  public ArchiveDestinationException(String archiveTable, String message) {
    super(message);
    this.archiveTable = archiveTable;
  }

  public String archiveTable() {
    return archiveTable;
  }
}
