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
package net.pgprom.utils;

import static com.google.common.base.Preconditions.checkNotNull;

import com.typesafe.config.ConfigValue;

/**
 * Exception thrown when something about a specific {@link com.typesafe.config.ConfigValue} is
 * wrong.
 */
public class InvalidConfigException extends RuntimeException {
  private static final long serialVersionUID = -2553207218367960386L;

  public InvalidConfigException(final ConfigValue value,
                                final String message) {
    super(value.origin().description() + ": " + checkNotNull(message));
  }
}
