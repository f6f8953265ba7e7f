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
package com.tidelake.partition;

import com.tidelake.time.TimeRange;
import com.tidelake.time.TimeUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Object storage layout of partition files. The path only depends on the view instance, the bucket and the
 * fingerprint, so two materializers racing on the same bucket write the same object.
 */
public final class PartitionPaths {
  private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

  private PartitionPaths() {
  }

  public static String partitionPath(final String viewName, final String instanceId, final TimeRange insertRange, final String fingerprint) {
    return "views/" + viewName + "/" + sanitize(instanceId) + "/" + DAY_FORMAT.format(TimeUtils.toInstant(insertRange.getBegin())) + "/"
        + insertRange.getBegin() + "-" + insertRange.getEnd() + "-" + fingerprint + ".part";
  }

  public static String viewPrefix(final String viewName) {
    return "views/" + viewName + "/";
  }

  static String sanitize(final String value) {
    final StringBuilder buffer = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      buffer.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' ? c : '_');
    }
    return buffer.toString();
  }
}
