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

import net.pgprom.query.ReadRequest;
import net.pgprom.query.ReadResponse;

/**
 * The read side of a remote storage.
 * 
 * @since 1.0
 */
public interface SampleReader {

  /**
   * Runs all queries of the request.
   * @param request A non-null request.
   * @return A response with the matching series. Never partial: an error 
   * in any query fails the whole read.
   * @throws net.pgprom.exceptions.StoreException on failure.
   */
  public ReadResponse read(final ReadRequest request);
  
}
