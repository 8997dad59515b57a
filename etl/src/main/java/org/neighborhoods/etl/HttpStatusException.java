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
package org.neighborhoods.etl;

import java.io.IOException;

/**
 * Non-2xx HTTP response.
 *
 * <p>429 (rate limited) and 5xx responses are transient and may be retried;
 * other statuses are treated as permanent for the request that produced them.
 */
public class HttpStatusException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;

  public HttpStatusException(int statusCode, String message) {
    super("HTTP " + statusCode + ": " + message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return statusCode == 429 || statusCode >= 500;
  }
}
