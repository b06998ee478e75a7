package io.chkfs.locator;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Thrown when text is not a well formed CHK locator.
public class MalformedLocatorException extends IllegalArgumentException {

  private final String locator;

  /// @param message what is wrong with the text
  /// @param locator the rejected text
  public MalformedLocatorException(String message, String locator) {
    super(message + ": " + locator);
    this.locator = locator;
  }

  /// @param message what is wrong with the text
  /// @param locator the rejected text
  /// @param cause the underlying parse failure
  public MalformedLocatorException(String message, String locator, Throwable cause) {
    super(message + ": " + locator, cause);
    this.locator = locator;
  }

  /// @return the rejected text
  public String getLocator() {
    return locator;
  }
}
