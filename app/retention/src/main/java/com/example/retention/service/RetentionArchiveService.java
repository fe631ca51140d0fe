/*
 * Where: Retention archive
 * What: Copies expired rows into <table>_archive and deletes them, one transaction per chunk
 * Why: A chunk is either fully archived and removed or untouched; earlier chunks stay committed
 */
package com.example.retention.service;

import com.example.retention.policy.EntityDescriptor;
import com.example.retention.policy.RetentionPolicy;
import com.example.retention.query.ExpirationQuery;
import com.example.retention.repository.RetentionRepository;
import com.example.retention.repository.SchemaInspector;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class RetentionArchiveService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionArchiveService.class);

  static final int CHUNK_SIZE = 500;
  static final int INSERT_ROWS_PER_STATEMENT = 50;

  private final RetentionRepository repository;
  private final SchemaInspector schemaInspector;
  private final TransactionTemplate transactionTemplate;

  public RetentionArchiveService(
      RetentionRepository repository,
      SchemaInspector schemaInspector,
      PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.schemaInspector = schemaInspector;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Fails fast when the archive table is absent or lacks a column the source rows carry.
   *
   * @throws ArchiveTableMissingException when {@code <table>_archive} does not exist
   * @throws ArchiveSchemaMismatchException when columns are missing from it
   */
  public void validateDestination(EntityDescriptor entity) {
    final String archiveTable = entity.archiveTable();
    if (!schemaInspector.tableExists(archiveTable)) {
      throw new ArchiveTableMissingException(archiveTable);
    }
    final Set<String> required = new LinkedHashSet<>(schemaInspector.columnNames(entity.table()));
    required.remove(entity.idColumn().toLowerCase(Locale.ROOT));
    required.add(RetentionRepository.ARCHIVED_AT_COLUMN);
    required.removeAll(schemaInspector.columnNames(archiveTable));
    if (!required.isEmpty()) {
      throw new ArchiveSchemaMismatchException(archiveTable, required);
    }
  }

  /**
   * Archives up to {@code batchLimit} expired rows.
   *
   * @return rows archived by committed chunks
   * @throws ArchiveChunkFailedException after the failing chunk has been rolled back
   */
  public long archive(RetentionPolicy policy, ExpirationQuery query) {
    final EntityDescriptor entity = policy.entity();
    validateDestination(entity);

    final int batchLimit = policy.batchLimit();
    final int chunkSize = Math.min(CHUNK_SIZE, batchLimit);
    long archived = 0;
    Object cursor = null;
    while (archived < batchLimit) {
      if (Thread.currentThread().isInterrupted()) {
        logger.info(
            "retention archive interrupted between chunks entityType={} archived={}",
            entity.entityType(),
            archived);
        break;
      }
      final List<Map<String, Object>> fetched = repository.fetchBatch(query, cursor, chunkSize);
      if (fetched.isEmpty()) {
        break;
      }
      final int allowed = (int) Math.min(fetched.size(), batchLimit - archived);
      final List<Map<String, Object>> chunk = fetched.subList(0, allowed);
      cursor = chunk.get(chunk.size() - 1).get(entity.idColumn());
      archived += archiveChunk(entity, chunk, archived);
      if (fetched.size() < chunkSize) {
        break;
      }
    }
    return archived;
  }

  @VisibleForTesting
  int archiveChunk(EntityDescriptor entity, List<Map<String, Object>> chunk, long committedSoFar) {
    final List<String> columns = archivedColumns(entity, chunk.get(0));
    final List<Object> ids = new ArrayList<>(chunk.size());
    for (Map<String, Object> row : chunk) {
      ids.add(row.get(entity.idColumn()));
    }
    try {
      final Integer deleted =
          transactionTemplate.execute(
              status -> {
                for (List<Map<String, Object>> rows :
                    Lists.partition(chunk, INSERT_ROWS_PER_STATEMENT)) {
                  repository.insertArchiveRows(entity.archiveTable(), columns, rows);
                }
                return repository.deleteByIds(entity, ids);
              });
      if (deleted == null || deleted != chunk.size()) {
        // Rows deleted concurrently by the host are still archived; the copy is harmless.
        logger.warn(
            "retention archive deleted fewer rows than copied entityType={} copied={} deleted={}",
            entity.entityType(),
            chunk.size(),
            deleted);
      }
    } catch (RuntimeException ex) {
      throw new ArchiveChunkFailedException(entity.entityType(), committedSoFar, ex);
    }
    return chunk.size();
  }

  private List<String> archivedColumns(EntityDescriptor entity, Map<String, Object> sample) {
    final List<String> columns = new ArrayList<>(sample.size());
    for (String column : sample.keySet()) {
      if (!column.equalsIgnoreCase(entity.idColumn())) {
        columns.add(column);
      }
    }
    return columns;
  }
}
