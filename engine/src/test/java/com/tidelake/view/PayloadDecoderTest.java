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
package com.tidelake.view;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadDecoderTest {

  @Test
  void decodesWhatTheBuilderWrites() {
    final PayloadBuilder builder = new PayloadBuilder()
        .log(1_000L, "app::main", "WARN", "disk \"/var\" at 91%, \\ slow")
        .measure(2_000L, "latency", "app::http", "ms", 12.5)
        .beginScope(3_000L, "handle", "app::http", "http.rs", 42)
        .endAsync(4_000L, 7, 3, "fetch", "app::io", "io.rs", 12);

    final List<TelemetryEvent> events = PayloadDecoder.decode(builder.build());

    assertThat(events).hasSize(4);
    assertThat(events).extracting(TelemetryEvent::getKind).containsExactly(TelemetryEvent.Kind.LOG, TelemetryEvent.Kind.MEASURE,
        TelemetryEvent.Kind.BEGIN_SCOPE, TelemetryEvent.Kind.END_ASYNC);

    final TelemetryEvent log = events.get(0);
    assertThat(log.getTime()).isEqualTo(1_000L);
    assertThat(log.getString("msg")).isEqualTo("disk \"/var\" at 91%, \\ slow");
    assertThat(log.getString("level")).isEqualTo("WARN");

    assertThat(events.get(1).getDouble("value")).isEqualTo(12.5);
    assertThat(events.get(2).getLong("line")).isEqualTo(42L);
    assertThat(events.get(3).getLong("span_id")).isEqualTo(7L);
    assertThat(events.get(3).getLong("parent_span_id")).isEqualTo(3L);
  }

  @Test
  void tagsAreReadAsFallbackOfFields() {
    final List<TelemetryEvent> events = PayloadDecoder.decode("log,target=app::db,host=a\\ b level=\"INFO\",msg=\"connected\" 5000");

    assertThat(events).hasSize(1);
    assertThat(events.get(0).getTags()).containsEntry("host", "a b");
    assertThat(events.get(0).getString("target")).isEqualTo("app::db");
    assertThat(events.get(0).getString("missing")).isEmpty();
  }

  @Test
  void malformedLinesAreSkipped() {
    final String payload = String.join("\n",//
        "# comment",//
        "log msg=\"kept\" 1",//
        "unknown_kind msg=\"x\" 2",//
        "log msg=\"no timestamp\"",//
        "log msg=\"bad timestamp\" soon",//
        "log msg=\"unterminated 3",//
        "log 4",//
        "",//
        "measure name=\"kept too\",value=1.5 5");

    final List<TelemetryEvent> events = PayloadDecoder.decode(payload.getBytes(StandardCharsets.UTF_8));

    assertThat(events).extracting(e -> e.getString(e.getKind() == TelemetryEvent.Kind.LOG ? "msg" : "name"))
        .containsExactly("kept", "kept too");
  }

  @Test
  void oversizedStringIsRejected() {
    final String huge = "x".repeat(PayloadDecoder.MAX_STRING_LENGTH + 1);

    assertThat(PayloadDecoder.parseLine("log msg=\"" + huge + "\" 1")).isNull();
    assertThat(PayloadDecoder.decode((String) null)).isEmpty();
  }

  @Test
  void builderCountsEvents() {
    final PayloadBuilder builder = new PayloadBuilder().log(1, "t", "INFO", "a").log(2, "t", "INFO", "b\nc");

    assertThat(builder.getEventCount()).isEqualTo(2);
    assertThat(PayloadDecoder.decode(builder.build()).get(1).getString("msg")).isEqualTo("b c");
  }
}
