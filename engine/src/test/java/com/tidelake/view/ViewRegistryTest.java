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

import com.tidelake.columnar.ColumnDefinition;
import com.tidelake.columnar.ColumnType;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.CyclicViewDefinitionException;
import com.tidelake.exception.InvalidViewDefinitionException;
import com.tidelake.exception.ViewNotFoundException;
import com.tidelake.time.TimeGranularity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewRegistryTest {
  private static final TableSchema SCHEMA = TableSchema.of(ColumnDefinition.of("time", ColumnType.TIMESTAMP),
      ColumnDefinition.of("value", ColumnType.DOUBLE));

  private final ViewRegistry registry = new ViewRegistry();

  private static ViewDefinition root(final String name, final int updateGroup) {
    return ViewDefinition.builder(name).schema(SCHEMA).source(ViewSource.blocks("metrics")).transform((s, o) -> {
    }).eventTimeColumn("time").updateGroup(updateGroup).build();
  }

  private static ViewDefinition derived(final String name, final String upstream, final int updateGroup) {
    return ViewDefinition.builder(name).schema(SCHEMA).source(ViewSource.view(upstream)).transform((s, o) -> {
    }).eventTimeColumn("time").updateGroup(updateGroup).build();
  }

  private List<String> names() {
    return registry.getViews().stream().map(ViewDefinition::getName).toList();
  }

  @Test
  void upstreamViewsComeFirst() {
    registry.registerAll(List.of(derived("c", "b", 100), derived("b", "a", 200), root("a", 300), root("z", 50)));

    assertThat(names()).containsExactly("z", "a", "b", "c");
    assertThat(registry.getDependents("a")).containsExactly("b");
  }

  @Test
  void sameGroupIsOrderedByName() {
    registry.register(root("beta", 1000));
    registry.register(root("alpha", 1000));
    registry.register(root("first", 10));

    assertThat(names()).containsExactly("first", "alpha", "beta");
  }

  @Test
  void cycleIsRejectedAtomically() {
    registry.register(root("a", 1000));

    assertThatThrownBy(() -> registry.registerAll(List.of(derived("x", "y", 1000), derived("y", "x", 1000))))
        .isInstanceOf(CyclicViewDefinitionException.class).hasMessageContaining("x -> y -> x");
    assertThat(names()).containsExactly("a");
  }

  @Test
  void replaceCannotCloseACycle() {
    registry.register(root("a", 1000));
    registry.register(derived("b", "a", 1000));

    assertThatThrownBy(() -> registry.replace(derived("a", "b", 1000))).isInstanceOf(CyclicViewDefinitionException.class);
    assertThat(registry.get("a").getSource().getKind()).isEqualTo(ViewSource.Kind.BLOCKS);

    final ViewDefinition previous = registry.replace(root("a", 2000));
    assertThat(previous.getUpdateGroup()).isEqualTo(1000);
    assertThat(registry.get("a").getUpdateGroup()).isEqualTo(2000);
  }

  @Test
  void upstreamMustExist() {
    assertThatThrownBy(() -> registry.register(derived("orphan", "missing", 1000))).isInstanceOf(InvalidViewDefinitionException.class)
        .hasMessageContaining("missing");
    assertThat(registry.size()).isZero();
  }

  @Test
  void namesAreUnique() {
    registry.register(root("a", 1000));

    assertThatThrownBy(() -> registry.register(root("a", 2000))).isInstanceOf(InvalidViewDefinitionException.class);
    assertThatThrownBy(() -> registry.replace(root("unknown", 1000))).isInstanceOf(ViewNotFoundException.class);
  }

  @Test
  void viewWithDependentsCannotBeUnregistered() {
    registry.register(root("a", 1000));
    registry.register(derived("b", "a", 1000));

    assertThatThrownBy(() -> registry.unregister("a")).isInstanceOf(InvalidViewDefinitionException.class);

    registry.unregister("b");
    registry.unregister("a");
    assertThat(registry.exists("a")).isFalse();
    assertThat(registry.find("a")).isNull();
    assertThatThrownBy(() -> registry.get("a")).isInstanceOf(ViewNotFoundException.class);
  }

  @Test
  void fingerprintFollowsSchemaAndVersion() {
    final ViewDefinition v1 = root("a", 1000);
    final ViewDefinition v1Again = root("a", 2000);
    final ViewDefinition v2 = ViewDefinition.builder("a").schema(SCHEMA).source(ViewSource.blocks("metrics")).transform((s, o) -> {
    }).eventTimeColumn("time").version("2").build();

    assertThat(v1Again.getFingerprint()).isEqualTo(v1.getFingerprint());
    assertThat(v2.getFingerprint()).isNotEqualTo(v1.getFingerprint());
  }

  @Test
  void builtinViews() {
    BuiltinViews.registerAll(registry);

    assertThat(registry.size()).isEqualTo(7);
    assertThat(registry.get(BuiltinViews.THREAD_SPANS).isGlobal()).isFalse();
    assertThat(registry.get(BuiltinViews.LOG_ENTRIES).isScheduledAt(TimeGranularity.MINUTE)).isTrue();
    assertThat(registry.get(BuiltinViews.LOG_ENTRIES).isScheduledAt(TimeGranularity.DAY)).isFalse();
  }
}
