/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.tidelake;

import com.tidelake.exception.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationTest {

  @AfterEach
  void resetGlobals() {
    GlobalConfiguration.resetAll();
  }

  @Test
  void contextOverridesGlobalValues() {
    GlobalConfiguration.JIT_THREADS.setValue(6);
    final ContextConfiguration context = new ContextConfiguration();

    assertThat(context.getValueAsInteger(GlobalConfiguration.JIT_THREADS)).isEqualTo(6);
    assertThat(context.getValueAsLong(GlobalConfiguration.STORAGE_RETRY_MAX_BACKOFF)).isEqualTo(2_000L);

    context.setValue(GlobalConfiguration.JIT_THREADS, "3");
    assertThat(context.getValue(GlobalConfiguration.JIT_THREADS)).isEqualTo(3);
    assertThat(GlobalConfiguration.JIT_THREADS.getValueAsInteger()).isEqualTo(6);

    context.setValue(GlobalConfiguration.JIT_THREADS, null);
    assertThat(context.getValueAsInteger(GlobalConfiguration.JIT_THREADS)).isEqualTo(6);
  }

  @Test
  void valuesAreConvertedToTheSettingType() {
    GlobalConfiguration.MAINTENANCE_RETENTION.setValue(" 86400000 ");
    GlobalConfiguration.STORAGE_PATH.setValue(42);

    assertThat((Object) GlobalConfiguration.MAINTENANCE_RETENTION.getValue()).isEqualTo(86_400_000L);
    assertThat(GlobalConfiguration.STORAGE_PATH.getValueAsString()).isEqualTo("42");
    assertThat(GlobalConfiguration.STORAGE_PATH.isChanged()).isTrue();

    assertThatThrownBy(() -> GlobalConfiguration.JIT_THREADS.setValue("many")).isInstanceOf(NumberFormatException.class);
  }

  @Test
  void invalidPoolSizeIsRejected() {
    assertThatThrownBy(() -> GlobalConfiguration.METADATA_POOL_SIZE.setValue(0)).isInstanceOf(IllegalArgumentException.class);
    assertThat(GlobalConfiguration.METADATA_POOL_SIZE.isChanged()).isFalse();
  }

  @Test
  void contextJsonKeepsOnlyKnownSettings() {
    final ContextConfiguration context = new ContextConfiguration()
        .setValue(GlobalConfiguration.STORAGE_PATH, "/data/lake")
        .setValue(GlobalConfiguration.JIT_BUCKET, 60_000L);

    final ContextConfiguration copy = new ContextConfiguration();
    copy.fromJSON(context.toJSON());
    copy.fromJSON("{\"configuration\":{\"unknown.setting\":1}}");
    copy.fromJSON(null);

    assertThat(copy.getContextSize()).isEqualTo(2);
    assertThat(copy.getValueAsString(GlobalConfiguration.STORAGE_PATH)).isEqualTo("/data/lake");
    assertThat(copy.getValueAsLong(GlobalConfiguration.JIT_BUCKET)).isEqualTo(60_000L);
  }

  @Test
  void keysAreFoundByNameOrKey() {
    assertThat(GlobalConfiguration.findByKey("TIDELAKE.JIT.BUCKET")).isEqualTo(GlobalConfiguration.JIT_BUCKET);
    assertThat(GlobalConfiguration.findByKey("tidelake.none")).isNull();

    GlobalConfiguration.setConfiguration(Map.of("JIT_MAX_OBJECTS", 10, "tidelake.jit.threads", "2"));
    assertThat(GlobalConfiguration.JIT_MAX_OBJECTS.getValueAsLong()).isEqualTo(10L);
    assertThat(GlobalConfiguration.JIT_THREADS.getValueAsInteger()).isEqualTo(2);
  }

  @Test
  void dumpHidesSecrets() {
    GlobalConfiguration.METADATA_JDBC_PASSWORD.setValue("s3cret");
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    GlobalConfiguration.dumpConfiguration(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    final String dump = buffer.toString(StandardCharsets.UTF_8);
    assertThat(dump).contains("- METADATA", "tidelake.metadata.jdbcPassword = <hidden>", "tidelake.jit.bucket = ");
    assertThat(dump).doesNotContain("s3cret");
    assertThat(GlobalConfiguration.toJSON()).doesNotContain("s3cret");
  }

  @Test
  void invalidSettingsAreRejectedBeforeOpening() {
    assertThatThrownBy(() -> Lakehouse.builder()
        .configuration(TestHelper.newTestConfiguration().setValue(GlobalConfiguration.STORAGE_RETRY_ATTEMPTS, 0))
        .build()).isInstanceOf(ConfigurationException.class).hasMessageContaining("tidelake.storage.retryAttempts");

    assertThatThrownBy(() -> Lakehouse.builder()
        .configuration(TestHelper.newTestConfiguration().setValue(GlobalConfiguration.JIT_BUCKET, -1L))
        .build()).isInstanceOf(ConfigurationException.class).hasMessageContaining("tidelake.jit.bucket");
  }
}
