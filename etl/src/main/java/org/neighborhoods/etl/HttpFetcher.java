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
 * Fetches the body of a URL as text.
 *
 * <p>Collaborators that talk to remote services take a fetcher instead of
 * opening connections themselves, so tests can supply canned responses.
 *
 * @see UrlConnectionFetcher
 */
@FunctionalInterface
public interface HttpFetcher {

  /**
   * Performs a GET request.
   *
   * @param url Absolute URL, already encoded
   * @return Response body
   * @throws IOException On network failure or non-2xx status
   */
  String get(String url) throws IOException;
}
