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
package net.shardtsdb.query.ql;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Intercepts syntax errors instead of ANTLR's default of printing them to
 * stderr. Errors are logged at debug, as bad input is the caller's
 * problem, and rethrown as {@link QueryParseException}.
 */
public class ParseErrorListener extends BaseErrorListener {
  private static final Logger LOG = LoggerFactory.getLogger(
      ParseErrorListener.class);

  @Override
  public void syntaxError(final Recognizer<?, ?> recognizer,
                          final Object offending_symbol,
                          final int line,
                          final int char_position_in_line,
                          final String msg,
                          final RecognitionException e) {
    final String report = String.format("%d:%d: %s", line,
        char_position_in_line, msg);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Syntax error " + report);
    }
    throw new QueryParseException(report, e);
  }
}
