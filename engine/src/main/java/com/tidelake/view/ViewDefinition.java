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

import com.tidelake.columnar.ColumnType;
import com.tidelake.columnar.TableSchema;
import com.tidelake.exception.InvalidViewDefinitionException;
import com.tidelake.time.TimeGranularity;

import java.util.Objects;

/**
 * Declarative definition of a view: output schema, source and transform plus the scheduling attributes. Definitions
 * are data: the same materialization algorithm runs every view.
 */
public class ViewDefinition {
  /**
   * Instance id of the partitions of global views.
   */
  public static final String GLOBAL_INSTANCE = "global";

  private final String          name;
  private final TableSchema     schema;
  private final ViewSource      source;
  private final ViewTransform   transform;
  private final String          eventTimeColumn;
  private final TimeGranularity granularity;
  private final TimeGranularity mergeGranularity;
  private final InstanceKey     instanceKey;
  private final boolean         global;
  private final int             updateGroup;
  private final String          version;
  private final boolean         concatMergeable;
  private final String          fingerprint;

  private ViewDefinition(final Builder b) {
    this.name = b.name;
    this.schema = b.schema;
    this.source = b.source;
    this.transform = b.transform;
    this.eventTimeColumn = b.eventTimeColumn;
    this.granularity = b.granularity;
    this.mergeGranularity = b.mergeGranularity != null ? b.mergeGranularity : b.granularity;
    this.instanceKey = b.instanceKey;
    this.global = b.global;
    this.updateGroup = b.updateGroup;
    this.version = b.version;
    this.concatMergeable = b.concatMergeable;
    this.fingerprint = schema.fingerprint(name + "@" + version);
  }

  public static Builder builder(final String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public TableSchema getSchema() {
    return schema;
  }

  public ViewSource getSource() {
    return source;
  }

  public ViewTransform getTransform() {
    return transform;
  }

  public String getEventTimeColumn() {
    return eventTimeColumn;
  }

  /**
   * Finest bucket width the scheduler materializes.
   */
  public TimeGranularity getGranularity() {
    return granularity;
  }

  /**
   * Coarsest bucket width finer partitions are merged into.
   */
  public TimeGranularity getMergeGranularity() {
    return mergeGranularity;
  }

  public InstanceKey getInstanceKey() {
    return instanceKey;
  }

  /**
   * Tells if the scheduler materializes the view for all entities at once.
   */
  public boolean isGlobal() {
    return global;
  }

  public boolean supportsInstances() {
    return instanceKey != InstanceKey.NONE;
  }

  public int getUpdateGroup() {
    return updateGroup;
  }

  public String getVersion() {
    return version;
  }

  /**
   * Tells if the rows of adjacent partitions can be concatenated into a coarser partition. False for aggregates, whose
   * groups may span partitions.
   */
  public boolean isConcatMergeable() {
    return concatMergeable;
  }

  /**
   * Digest of the schema and version, stored in every partition. Partitions with another fingerprint are stale.
   */
  public String getFingerprint() {
    return fingerprint;
  }

  /**
   * Tells if the view is processed by the scheduled task of the given granularity.
   */
  public boolean isScheduledAt(final TimeGranularity taskGranularity) {
    return global && granularity.compareTo(taskGranularity) <= 0 && taskGranularity.compareTo(mergeGranularity) <= 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ViewDefinition))
      return false;
    final ViewDefinition that = (ViewDefinition) o;
    return name.equals(that.name) && fingerprint.equals(that.fingerprint);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fingerprint);
  }

  @Override
  public String toString() {
    return "View{" + name + ", source=" + source + ", granularity=" + granularity + ".." + mergeGranularity + ", instance=" + instanceKey
        + ", fingerprint=" + fingerprint + "}";
  }

  public static class Builder {
    private final String          name;
    private       TableSchema     schema;
    private       ViewSource      source;
    private       ViewTransform   transform;
    private       String          eventTimeColumn;
    private       TimeGranularity granularity      = TimeGranularity.MINUTE;
    private       TimeGranularity mergeGranularity;
    private       InstanceKey     instanceKey      = InstanceKey.NONE;
    private       boolean         global           = true;
    private       int             updateGroup      = 1000;
    private       String          version          = "1";
    private       boolean         concatMergeable  = true;

    private Builder(final String name) {
      this.name = name;
    }

    public Builder schema(final TableSchema schema) {
      this.schema = schema;
      return this;
    }

    public Builder source(final ViewSource source) {
      this.source = source;
      return this;
    }

    public Builder transform(final ViewTransform transform) {
      this.transform = transform;
      return this;
    }

    public Builder eventTimeColumn(final String eventTimeColumn) {
      this.eventTimeColumn = eventTimeColumn;
      return this;
    }

    public Builder granularity(final TimeGranularity granularity) {
      this.granularity = granularity;
      return this;
    }

    public Builder mergeGranularity(final TimeGranularity mergeGranularity) {
      this.mergeGranularity = mergeGranularity;
      return this;
    }

    public Builder instanceKey(final InstanceKey instanceKey) {
      this.instanceKey = instanceKey;
      return this;
    }

    public Builder global(final boolean global) {
      this.global = global;
      return this;
    }

    public Builder updateGroup(final int updateGroup) {
      this.updateGroup = updateGroup;
      return this;
    }

    public Builder version(final String version) {
      this.version = version;
      return this;
    }

    public Builder concatMergeable(final boolean concatMergeable) {
      this.concatMergeable = concatMergeable;
      return this;
    }

    /**
     * @throws InvalidViewDefinitionException if a mandatory attribute is missing or inconsistent
     */
    public ViewDefinition build() {
      if (name == null || !name.matches("[A-Za-z0-9_]+"))
        throw new InvalidViewDefinitionException(name, "view names can only contain letters, digits and underscores");
      if (schema == null)
        throw new InvalidViewDefinitionException(name, "missing schema");
      if (source == null)
        throw new InvalidViewDefinitionException(name, "missing source");
      if (transform == null)
        throw new InvalidViewDefinitionException(name, "missing transform");
      if (eventTimeColumn == null)
        throw new InvalidViewDefinitionException(name, "missing event time column");
      final int timeIndex = schema.indexOf(eventTimeColumn);
      if (timeIndex < 0 || schema.getColumn(timeIndex).getType() != ColumnType.TIMESTAMP)
        throw new InvalidViewDefinitionException(name, "event time column '" + eventTimeColumn + "' is not a TIMESTAMP column of the schema");
      if (mergeGranularity != null && mergeGranularity.compareTo(granularity) < 0)
        throw new InvalidViewDefinitionException(name, "merge granularity " + mergeGranularity + " is finer than " + granularity);
      if (!global && instanceKey == InstanceKey.NONE)
        throw new InvalidViewDefinitionException(name, "a view must be global or keyed on an entity");
      return new ViewDefinition(this);
    }
  }
}
