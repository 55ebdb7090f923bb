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
package net.pgprom.storage;

/**
 * A store that can both accept remote writes and answer remote reads.
 * 
 * @since 1.0
 */
public abstract class TsdbStore implements SampleWriter, SampleReader {

  /** @return A human readable name of the backend. */
  public abstract String name();
  
  /**
   * Checks that the backend can be reached.
   * @throws net.pgprom.exceptions.ConnectionException if it can't.
   */
  public abstract void healthCheck();
  
}
