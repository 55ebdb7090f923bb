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
package net.pgprom.exceptions;

/**
 * Thrown when streaming or committing a batch of samples failed. The
 * batch has been rolled back when this is thrown.
 * 
 * @since 1.0
 */
public class WriteException extends StoreException {
  private static final long serialVersionUID = 5523097183344075390L;

  /**
   * Ctor with a message.
   * @param msg A descriptive message about the exception.
   */
  public WriteException(final String msg) {
    super(msg);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A descriptive message about the exception.
   * @param cause The exception that caused this one.
   */
  public WriteException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
