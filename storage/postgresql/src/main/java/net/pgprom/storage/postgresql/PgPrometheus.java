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

/**
 * Names provided by the pg_prometheus extension.
 */
public final class PgPrometheus {
  public static final String EXTENSION = "pg_prometheus";
  
  /** The column of the samples table holding the prom_sample. */
  public static final String SAMPLE_COLUMN = "sample";
  
  public static final String TIME = "prom_time(" + SAMPLE_COLUMN + ")";
  public static final String NAME = "prom_name(" + SAMPLE_COLUMN + ")";
  public static final String VALUE = "prom_value(" + SAMPLE_COLUMN + ")";
  public static final String LABELS = "prom_labels(" + SAMPLE_COLUMN + ")";
  
  public static final String CREATE_EXTENSION = 
      "CREATE EXTENSION IF NOT EXISTS " + EXTENSION;
  public static final String CREATE_TABLE = "SELECT create_prometheus_table("
      + "?, ?, normalized_tables => ?, keep_samples => ?)";
  
  public static final String HEALTH_CHECK = "SELECT 1";
  
  private PgPrometheus() {
  }
}
