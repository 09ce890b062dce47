/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.aperio.salesforce;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The API answered with an HTTP status of 400 or above.
 *
 * <p>The message is taken from the platform's structured error list when the body carries one,
 * otherwise it is the raw body text.
 */
public class RemoteApiException extends SalesforceException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final @Nullable String errorCode;

  public RemoteApiException(int statusCode, @Nullable String errorCode, String message) {
    super(message);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** First platform error code in the response, e.g. {@code INVALID_FIELD}. */
  public @Nullable String getErrorCode() {
    return errorCode;
  }
}
