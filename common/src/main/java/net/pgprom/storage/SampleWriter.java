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

import java.util.List;

import net.pgprom.data.Sample;

/**
 * The write side of a remote storage.
 * 
 * @since 1.0
 */
public interface SampleWriter {

  /**
   * Writes the samples in order. Either every sample is stored or none is.
   * @param samples A non-null, possibly empty list of samples.
   * @throws net.pgprom.exceptions.WriteException if the batch could not 
   * be stored. Nothing was written in that case.
   */
  public void write(final List<Sample> samples);
  
}
