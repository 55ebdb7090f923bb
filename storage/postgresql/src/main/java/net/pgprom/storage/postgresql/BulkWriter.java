// This file is part of pgprom.
// Copyright (C) 2026  The pgprom Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pgprom.storage.postgresql;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import org.postgresql.PGConnection;
import org.postgresql.copy.CopyIn;
import org.postgresql.copy.CopyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import net.pgprom.core.Const;
import net.pgprom.data.Sample;
import net.pgprom.exceptions.WriteException;

/**
 * Streams a batch of samples into the samples table with 
 * {@code COPY ... FROM STDIN} inside a single transaction. The batch is 
 * committed only after every line went out and the copy completed, any 
 * failure cancels the copy and rolls the transaction back.
 * <p>
 * The connection is left with auto-commit disabled; callers are expected 
 * to close it afterwards.
 * 
 * @since 1.0
 */
public class BulkWriter {
  private static final Logger LOG = LoggerFactory.getLogger(BulkWriter.class);
  
  /** The COPY statement. */
  private final String copy_sql;
  
  /**
   * Default ctor.
   * @param table The non-null, non-empty samples table name.
   */
  public BulkWriter(final String table) {
    if (Strings.isNullOrEmpty(table)) {
      throw new IllegalArgumentException("Table cannot be null or empty.");
    }
    copy_sql = "COPY " + SqlStrings.quoteIdentifier(table) + " FROM STDIN";
  }
  
  /** @return The COPY statement used. */
  public String copySql() {
    return copy_sql;
  }
  
  /**
   * Writes the samples in order.
   * @param connection A non-null open connection to PostgreSQL.
   * @param samples A non-null list of samples. Empty lists are a no-op.
   * @return The number of rows the server reported as copied.
   * @throws WriteException if anything failed. Nothing was committed.
   */
  public long write(final Connection connection, final List<Sample> samples) {
    Preconditions.checkNotNull(connection, "Connection cannot be null.");
    Preconditions.checkNotNull(samples, "Samples cannot be null.");
    if (samples.isEmpty()) {
      return 0;
    }
    
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      throw new WriteException("Failed to start a transaction", e);
    }
    
    CopyIn copy = null;
    try {
      final CopyManager copy_manager = 
          connection.unwrap(PGConnection.class).getCopyAPI();
      copy = copy_manager.copyIn(copy_sql);
      for (final Sample sample : samples) {
        final byte[] line = SeriesFormat.line(sample)
            .getBytes(Const.UTF8_CHARSET);
        copy.writeToCopy(line, 0, line.length);
      }
      final long rows = copy.endCopy();
      connection.commit();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Copied " + rows + " samples into " + copy_sql);
      }
      return rows;
    } catch (SQLException | RuntimeException e) {
      cancel(copy, e);
      rollback(connection, e);
      LOG.warn("Rolled back a batch of " + samples.size() + " samples", e);
      throw new WriteException("Failed to write a batch of " 
          + samples.size() + " samples", e);
    }
  }
  
  private static void cancel(final CopyIn copy, final Exception cause) {
    if (copy == null || !copy.isActive()) {
      return;
    }
    try {
      copy.cancelCopy();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
  
  private static void rollback(final Connection connection, 
                               final Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
