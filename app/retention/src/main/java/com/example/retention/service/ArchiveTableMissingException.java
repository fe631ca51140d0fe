package com.example.retention.service;

public class ArchiveTableMissingException extends ArchiveDestinationException {

  private static final long serialVersionUID = 1L;

  public ArchiveTableMissingException(String archiveTable) {
    super(
        archiveTable,
        "Archive table '"
            + archiveTable
            + "' does not exist. Create it with every source column except the identifier,"
            + " plus archived_at.");
  }
}
