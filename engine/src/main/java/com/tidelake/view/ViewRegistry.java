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

import com.tidelake.exception.CyclicViewDefinitionException;
import com.tidelake.exception.InvalidViewDefinitionException;
import com.tidelake.exception.ViewNotFoundException;
import com.tidelake.log.LogManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.logging.Level;

/**
 * Registered view definitions. Views reading other views form a DAG: any registration introducing a cycle is rejected
 * before it becomes visible.
 */
public class ViewRegistry {
  private static final Comparator<ViewDefinition> UPDATE_ORDER = Comparator.comparingInt(ViewDefinition::getUpdateGroup)
      .thenComparing(ViewDefinition::getName);

  private final Map<String, ViewDefinition> views = new LinkedHashMap<>();

  /**
   * @throws InvalidViewDefinitionException if a view with the same name exists or the upstream view is missing
   * @throws CyclicViewDefinitionException   if the view closes a cycle
   */
  public synchronized void register(final ViewDefinition view) {
    if (views.containsKey(view.getName()))
      throw new InvalidViewDefinitionException(view.getName(), "view already registered");
    registerAll(List.of(view));
  }

  /**
   * Registers the views as a whole: either all of them become visible or none does. Views of the batch can reference
   * each other regardless of their order.
   */
  public synchronized void registerAll(final Collection<ViewDefinition> batch) {
    final Map<String, ViewDefinition> candidate = new LinkedHashMap<>(views);
    for (final ViewDefinition v : batch) {
      if (candidate.containsKey(v.getName()))
        throw new InvalidViewDefinitionException(v.getName(), "view already registered");
      candidate.put(v.getName(), v);
    }
    validate(candidate);
    views.clear();
    views.putAll(candidate);
    for (final ViewDefinition v : batch)
      LogManager.instance().log(this, Level.FINE, "Registered view %s", null, v);
  }

  /**
   * Replaces the definition of a view. Partitions materialized with the previous fingerprint become stale.
   *
   * @return the previous definition
   */
  public synchronized ViewDefinition replace(final ViewDefinition view) {
    final ViewDefinition previous = get(view.getName());
    final Map<String, ViewDefinition> candidate = new LinkedHashMap<>(views);
    candidate.put(view.getName(), view);
    validate(candidate);
    views.put(view.getName(), view);
    if (!previous.getFingerprint().equals(view.getFingerprint()))
      LogManager.instance().log(this, Level.INFO, "View '%s' changed fingerprint %s -> %s", null, view.getName(), previous.getFingerprint(),
          view.getFingerprint());
    return previous;
  }

  /**
   * @throws InvalidViewDefinitionException if other views read from it
   */
  public synchronized ViewDefinition unregister(final String name) {
    final ViewDefinition view = get(name);
    final List<String> dependents = getDependents(name);
    if (!dependents.isEmpty())
      throw new InvalidViewDefinitionException(name, "views " + dependents + " depend on it");
    views.remove(name);
    return view;
  }

  /**
   * @throws ViewNotFoundException if the view is not registered
   */
  public synchronized ViewDefinition get(final String name) {
    final ViewDefinition view = views.get(name);
    if (view == null)
      throw new ViewNotFoundException(name);
    return view;
  }

  public synchronized ViewDefinition find(final String name) {
    return views.get(name);
  }

  public synchronized boolean exists(final String name) {
    return views.containsKey(name);
  }

  public synchronized List<String> getDependents(final String name) {
    final List<String> result = new ArrayList<>();
    for (final ViewDefinition v : views.values())
      if (v.getSource().getKind() == ViewSource.Kind.VIEW && v.getSource().getUpstreamView().equals(name))
        result.add(v.getName());
    return result;
  }

  /**
   * All the views, upstream views always before their dependents, then by update group and name.
   */
  public synchronized List<ViewDefinition> getViews() {
    final Map<String, Integer> pending = new HashMap<>();
    final Map<String, List<ViewDefinition>> dependents = new HashMap<>();
    final PriorityQueue<ViewDefinition> ready = new PriorityQueue<>(UPDATE_ORDER);

    for (final ViewDefinition v : views.values()) {
      final String upstream = upstreamOf(v);
      if (upstream == null)
        ready.add(v);
      else {
        pending.put(v.getName(), 1);
        dependents.computeIfAbsent(upstream, k -> new ArrayList<>()).add(v);
      }
    }

    final List<ViewDefinition> ordered = new ArrayList<>(views.size());
    while (!ready.isEmpty()) {
      final ViewDefinition v = ready.poll();
      ordered.add(v);
      for (final ViewDefinition d : dependents.getOrDefault(v.getName(), List.of()))
        if (pending.merge(d.getName(), -1, Integer::sum) == 0)
          ready.add(d);
    }
    return ordered;
  }

  public synchronized int size() {
    return views.size();
  }

  private static void validate(final Map<String, ViewDefinition> candidate) {
    // CYCLES FIRST: A CYCLE IS ALWAYS MADE OF EXISTING VIEWS
    final Map<String, Integer> state = new HashMap<>();
    for (final String name : candidate.keySet())
      visit(name, candidate, state, new ArrayList<>());

    for (final ViewDefinition v : candidate.values()) {
      final String upstreamName = upstreamOf(v);
      if (upstreamName == null)
        continue;
      final ViewDefinition upstream = candidate.get(upstreamName);
      if (upstream == null)
        throw new InvalidViewDefinitionException(v.getName(), "upstream view '" + upstreamName + "' is not registered");
      if (v.isGlobal() && !upstream.isGlobal())
        throw new InvalidViewDefinitionException(v.getName(), "a global view cannot read the instance-only view '" + upstreamName + "'");
      if (v.getInstanceKey() != InstanceKey.NONE && v.getInstanceKey() != upstream.getInstanceKey())
        throw new InvalidViewDefinitionException(v.getName(),
            "instance key " + v.getInstanceKey() + " differs from the one of '" + upstreamName + "' (" + upstream.getInstanceKey() + ")");
    }
  }

  private static void visit(final String name, final Map<String, ViewDefinition> candidate, final Map<String, Integer> state,
      final List<String> path) {
    final Integer s = state.get(name);
    if (s != null && s == 2)
      return;
    if (s != null && s == 1) {
      final List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
      cycle.add(name);
      throw new CyclicViewDefinitionException(cycle);
    }

    final ViewDefinition view = candidate.get(name);
    if (view == null)
      return;

    state.put(name, 1);
    path.add(name);
    final String upstream = upstreamOf(view);
    if (upstream != null)
      visit(upstream, candidate, state, path);
    path.remove(path.size() - 1);
    state.put(name, 2);
  }

  private static String upstreamOf(final ViewDefinition view) {
    return view.getSource().getKind() == ViewSource.Kind.VIEW ? view.getSource().getUpstreamView() : null;
  }
}
