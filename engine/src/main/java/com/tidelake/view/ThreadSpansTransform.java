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

import com.tidelake.columnar.RecordBatchBuilder;
import com.tidelake.metadata.BlockMetadata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the spans of one thread from its scope events. Begin and end events are paired with a stack; scopes still open
 * at the end of a block are closed at the block end time. Span ids are assigned in begin order within a block, 0 being
 * the parent of root spans.
 */
public class ThreadSpansTransform implements ViewTransform {

  private static final class OpenScope {
    final long   id;
    final long   parent;
    final int    depth;
    final long   begin;
    final TelemetryEvent event;

    OpenScope(final long id, final long parent, final int depth, final long begin, final TelemetryEvent event) {
      this.id = id;
      this.parent = parent;
      this.depth = depth;
      this.begin = begin;
      this.event = event;
    }
  }

  @Override
  public void apply(final SourceData source, final RecordBatchBuilder output) {
    for (final SourceData.BlockData data : source.getBlocks()) {
      final BlockMetadata block = data.getBlock();
      final Deque<OpenScope> stack = new ArrayDeque<>();
      final List<Object[]> spans = new ArrayList<>();
      long nextId = 1;

      for (final TelemetryEvent event : data.getEvents()) {
        if (event.getKind() == TelemetryEvent.Kind.BEGIN_SCOPE) {
          final long parent = stack.isEmpty() ? 0 : stack.peek().id;
          stack.push(new OpenScope(nextId++, parent, stack.size(), event.getTime(), event));
        } else if (event.getKind() == TelemetryEvent.Kind.END_SCOPE) {
          if (stack.isEmpty())
            // END WITHOUT BEGIN: THE SCOPE STARTED IN A PREVIOUS BLOCK
            continue;
          spans.add(span(block, stack.pop(), event.getTime()));
        }
      }
      while (!stack.isEmpty())
        spans.add(span(block, stack.pop(), block.getEndTime()));

      spans.sort((a, b) -> Long.compare((Long) a[6], (Long) b[6]));
      for (final Object[] row : spans)
        output.append(row);
    }
  }

  private static Object[] span(final BlockMetadata block, final OpenScope scope, final long end) {
    final TelemetryEvent e = scope.event;
    final long endTime = Math.max(end, scope.begin);
    return new Object[] { block.getStreamId(), block.getBlockId(), scope.id, scope.parent, (long) scope.depth,
        scopeHash(e.getString("name"), e.getString("target"), e.getString("filename"), e.getLong("line")), scope.begin, endTime,
        endTime - scope.begin, e.getString("name"), e.getString("target"), e.getString("filename"), e.getLong("line") };
  }

  /**
   * Stable identity of a scope, shared by all its spans.
   */
  static long scopeHash(final String name, final String target, final String filename, final long line) {
    long hash = 0xcbf29ce484222325L;
    for (final String part : new String[] { name, target, filename, Long.toString(line) }) {
      for (int i = 0; i < part.length(); i++) {
        hash ^= part.charAt(i);
        hash *= 0x100000001b3L;
      }
      hash ^= 0xff;
      hash *= 0x100000001b3L;
    }
    return hash;
  }
}
