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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link EnvironmentSubstitutor}.
 */
@Tag("unit")
class EnvironmentSubstitutorTest {

  @Test
  void testReferenceResolved() {
    assertEquals("key=abc123", EnvironmentSubstitutor.substitute("key={env:CENSUS_API_KEY}",
        Collections.singletonMap("CENSUS_API_KEY", "abc123")::get));
  }

  @Test
  void testUnsetVariableResolvesEmpty() {
    assertEquals("", EnvironmentSubstitutor.substitute("{env:UNSET_VAR}",
        Collections.<String, String>emptyMap()::get));
  }

  @Test
  void testPlainStringsPassThrough() {
    assertEquals("block", EnvironmentSubstitutor.substitute("block"));
    assertNull(EnvironmentSubstitutor.substitute(null));
  }
}
