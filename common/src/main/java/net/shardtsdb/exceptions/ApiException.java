// This file is part of ShardTSDB.
// Copyright (C) 2026  The ShardTSDB Authors.
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
package net.shardtsdb.exceptions;

/**
 * An error returned to API callers with a classification that maps to a
 * response status.
 */
public class ApiException extends RuntimeException {
  private static final long serialVersionUID = -4416396547362183945L;

  /** Error classification with the matching status code. */
  public static enum ErrorType {
    BAD_DATA("bad_data", 400),
    EXECUTION("execution", 422),
    CANCELED("canceled", 499),
    INTERNAL("internal", 500),
    UNAVAILABLE("unavailable", 503),
    TIMEOUT("timeout", 503);

    private final String name;
    private final int status;

    private ErrorType(final String name, final int status) {
      this.name = name;
      this.status = status;
    }

    /** @return The name used in responses. */
    public String typeName() {
      return name;
    }

    public int status() {
      return status;
    }

    /** @return True for server side errors worth retrying. */
    public boolean isRecoverable() {
      return status >= 500;
    }
  }

  private final ErrorType type;

  public ApiException(final ErrorType type, final String msg) {
    super(msg);
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    this.type = type;
  }

  public ApiException(final ErrorType type,
                      final String msg,
                      final Throwable cause) {
    super(msg, cause);
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    this.type = type;
  }

  public ErrorType type() {
    return type;
  }

  public int status() {
    return type.status();
  }

  public boolean isRecoverable() {
    return type.isRecoverable();
  }
}
