package com.example.retention.service;

import java.util.Set;

public class ArchiveSchemaMismatchException extends ArchiveDestinationException {

  private static final long serialVersionUID = 1L;

  public ArchiveSchemaMismatchException(String archiveTable, Set<String> missingColumns) {
    super(
        archiveTable,
        "Archive table '" + archiveTable + "' is missing columns " + missingColumns);
  }
}
