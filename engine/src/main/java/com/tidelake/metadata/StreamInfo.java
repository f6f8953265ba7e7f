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
package com.tidelake.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sequence of blocks of one telemetry kind emitted by one process. The tags tell which views consume the stream
 * ({@code log}, {@code metrics}, {@code cpu}); the dependency and object metadata are opaque JSON documents describing
 * how to decode the payloads.
 */
public class StreamInfo {
  public static final String TAG_LOG     = "log";
  public static final String TAG_METRICS = "metrics";
  public static final String TAG_CPU     = "cpu";

  private final String              streamId;
  private final String              processId;
  private final List<String>        tags;
  private final Map<String, String> properties;
  private final String              dependenciesMetadata;
  private final String              objectsMetadata;
  private final long                insertTime;

  public StreamInfo(final String streamId, final String processId, final List<String> tags, final Map<String, String> properties,
      final String dependenciesMetadata, final String objectsMetadata, final long insertTime) {
    this.streamId = Objects.requireNonNull(streamId, "streamId");
    this.processId = Objects.requireNonNull(processId, "processId");
    this.tags = List.copyOf(tags);
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties != null ? properties : Map.of()));
    this.dependenciesMetadata = dependenciesMetadata != null ? dependenciesMetadata : "[]";
    this.objectsMetadata = objectsMetadata != null ? objectsMetadata : "[]";
    this.insertTime = insertTime;
  }

  public StreamInfo(final String streamId, final String processId, final List<String> tags, final long insertTime) {
    this(streamId, processId, tags, Map.of(), null, null, insertTime);
  }

  public String getStreamId() {
    return streamId;
  }

  public String getProcessId() {
    return processId;
  }

  public List<String> getTags() {
    return tags;
  }

  public boolean hasTag(final String tag) {
    return tags.contains(tag);
  }

  public Map<String, String> getProperties() {
    return properties;
  }

  public String getDependenciesMetadata() {
    return dependenciesMetadata;
  }

  public String getObjectsMetadata() {
    return objectsMetadata;
  }

  public long getInsertTime() {
    return insertTime;
  }

  @Override
  public String toString() {
    return "Stream{" + streamId + ", process=" + processId + ", tags=" + tags + "}";
  }
}
