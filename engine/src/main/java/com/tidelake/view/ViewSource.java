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

import java.util.Objects;

/**
 * Where the rows of a view come from: the payloads of the blocks of streams carrying a tag, the metadata records
 * themselves, or the partitions of another view.
 */
public final class ViewSource {
  public enum Kind {
    BLOCKS,
    METADATA,
    VIEW
  }

  public enum MetadataKind {
    PROCESSES,
    STREAMS,
    BLOCKS
  }

  private final Kind         kind;
  private final String       streamTag;
  private final MetadataKind metadataKind;
  private final String       upstreamView;

  private ViewSource(final Kind kind, final String streamTag, final MetadataKind metadataKind, final String upstreamView) {
    this.kind = kind;
    this.streamTag = streamTag;
    this.metadataKind = metadataKind;
    this.upstreamView = upstreamView;
  }

  public static ViewSource blocks(final String streamTag) {
    return new ViewSource(Kind.BLOCKS, Objects.requireNonNull(streamTag, "streamTag"), null, null);
  }

  public static ViewSource metadata(final MetadataKind metadataKind) {
    return new ViewSource(Kind.METADATA, null, Objects.requireNonNull(metadataKind, "metadataKind"), null);
  }

  public static ViewSource view(final String upstreamView) {
    return new ViewSource(Kind.VIEW, null, null, Objects.requireNonNull(upstreamView, "upstreamView"));
  }

  public Kind getKind() {
    return kind;
  }

  public String getStreamTag() {
    return streamTag;
  }

  public MetadataKind getMetadataKind() {
    return metadataKind;
  }

  public String getUpstreamView() {
    return upstreamView;
  }

  @Override
  public String toString() {
    switch (kind) {
    case BLOCKS:
      return "blocks[" + streamTag + "]";
    case METADATA:
      return "metadata[" + metadataKind + "]";
    default:
      return "view[" + upstreamView + "]";
    }
  }
}
