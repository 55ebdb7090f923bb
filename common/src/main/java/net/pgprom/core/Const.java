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
package net.pgprom.core;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/** Constants used throughout the adapter. */
public final class Const {

  /** The reserved label carrying the metric name in the remote protocol. */
  public static final String METRIC_NAME_LABEL = "__name__";

  /** Charset used for everything we put on the wire. */
  public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;

  private Const() {
    // Constants only
  }
}
