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

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.tidelake.exception.ConfigurationException;
import com.tidelake.exception.DuplicatedKeyException;
import com.tidelake.exception.LakehouseIsClosedException;
import com.tidelake.log.LogManager;
import com.tidelake.maintenance.Deduplicator;
import com.tidelake.maintenance.MaintenanceTask;
import com.tidelake.maintenance.PartitionGarbageCollector;
import com.tidelake.maintenance.SchemaRetirement;
import com.tidelake.materialize.JitPartitionGenerator;
import com.tidelake.materialize.LeaseManager;
import com.tidelake.materialize.MaterializerScheduler;
import com.tidelake.materialize.PartitionMaterializer;
import com.tidelake.materialize.RetryPolicy;
import com.tidelake.materialize.SourceResolver;
import com.tidelake.metadata.BlockMetadata;
import com.tidelake.metadata.JdbcMetadataStore;
import com.tidelake.metadata.MetadataDataSource;
import com.tidelake.metadata.MetadataStore;
import com.tidelake.metadata.ProcessInfo;
import com.tidelake.metadata.StreamInfo;
import com.tidelake.partition.JdbcPartitionStore;
import com.tidelake.partition.PartitionLocks;
import com.tidelake.partition.PartitionMetadataCache;
import com.tidelake.partition.PartitionReader;
import com.tidelake.partition.PartitionStore;
import com.tidelake.query.LakehouseCatalog;
import com.tidelake.query.LakehouseFunctions;
import com.tidelake.query.PartitionScanner;
import com.tidelake.storage.BlobStore;
import com.tidelake.storage.ContentCache;
import com.tidelake.storage.FileSystemBlobStore;
import com.tidelake.storage.InMemoryBlobStore;
import com.tidelake.view.BuiltinViews;
import com.tidelake.view.ViewDefinition;
import com.tidelake.view.ViewRegistry;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;

/**
 * Entry point of the lakehouse: wires the metadata store, the object storage, the caches, the view registry, the
 * materializers, the maintenance task and the query bridge from one configuration.
 * <p>
 * Nothing runs in background until {@link #start()} is called.
 */
public class Lakehouse implements AutoCloseable {
  private final ContextConfiguration   configuration;
  private final Clock                  clock;
  private final MetadataDataSource     dataSource;
  private final MetadataStore          metadataStore;
  private final PartitionStore         partitionStore;
  private final BlobStore              blobStore;
  private final ContentCache           contentCache;
  private final PartitionMetadataCache metadataCache;
  private final PartitionReader        partitionReader;
  private final PartitionLocks         partitionLocks = new PartitionLocks();
  private final LoadingCache<String, ReentrantLock> blockLocks = Caffeine.newBuilder().weakValues().build(k -> new ReentrantLock());
  private final ViewRegistry           registry;
  private final SourceResolver         sourceResolver;
  private final PartitionMaterializer  materializer;
  private final ExecutorService        jitExecutor;
  private final JitPartitionGenerator  jitGenerator;
  private final MaterializerScheduler  scheduler;
  private final Deduplicator           deduplicator;
  private final SchemaRetirement       schemaRetirement;
  private final MaintenanceTask        maintenanceTask;
  private final LakehouseCatalog       catalog;
  private final LakehouseFunctions     functions;
  private       boolean                started;
  private volatile boolean             closed;

  private Lakehouse(final Builder builder) {
    this.configuration = builder.configuration;
    this.clock = builder.clock;

    // VALIDATE BEFORE OPENING ANY RESOURCE
    final RetryPolicy retryPolicy = RetryPolicy.fromConfiguration(configuration);
    final long jitBucket = configuration.getValueAsLong(GlobalConfiguration.JIT_BUCKET);
    if (jitBucket <= 0)
      throw new ConfigurationException(GlobalConfiguration.JIT_BUCKET.getKey() + " configuration is invalid (" + jitBucket + ")");

    this.dataSource = new MetadataDataSource(configuration);
    this.metadataStore = new JdbcMetadataStore(dataSource);
    this.partitionStore = new JdbcPartitionStore(dataSource);

    this.blobStore = builder.blobStore != null ? builder.blobStore : createBlobStore(configuration);
    this.contentCache = new ContentCache(blobStore, configuration.getValueAsLong(GlobalConfiguration.CACHE_CONTENT_BYTES),
        configuration.getValueAsLong(GlobalConfiguration.CACHE_CONTENT_MAX_FILE_BYTES));
    this.metadataCache = new PartitionMetadataCache(partitionStore,
        configuration.getValueAsLong(GlobalConfiguration.CACHE_PARTITION_METADATA_ENTRIES));
    this.partitionReader = new PartitionReader(contentCache);

    this.registry = new ViewRegistry();
    if (builder.builtinViews)
      BuiltinViews.registerAll(registry);
    if (!builder.views.isEmpty())
      registry.registerAll(builder.views);

    this.sourceResolver = new SourceResolver(metadataStore, partitionStore, partitionReader, blobStore, registry);
    this.materializer = new PartitionMaterializer(sourceResolver, partitionStore, metadataCache, partitionReader, contentCache, blobStore,
        retryPolicy, clock, partitionLocks);

    final AtomicInteger jitThreadId = new AtomicInteger();
    this.jitExecutor = Executors.newFixedThreadPool(configuration.getValueAsInteger(GlobalConfiguration.JIT_THREADS), r -> {
      final Thread t = new Thread(r, "TideLake-JIT-" + jitThreadId.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    this.jitGenerator = new JitPartitionGenerator(registry, metadataStore, sourceResolver, materializer, metadataCache,
        new LeaseManager(jitExecutor, configuration.getValueAsLong(GlobalConfiguration.JIT_LEASE_TIMEOUT)),
        jitBucket, configuration.getValueAsLong(GlobalConfiguration.JIT_MAX_OBJECTS));

    this.scheduler = new MaterializerScheduler(registry, materializer, clock, configuration);

    this.deduplicator = new Deduplicator(metadataStore);
    this.schemaRetirement = new SchemaRetirement(registry, partitionStore, metadataCache, clock);
    final PartitionGarbageCollector collector = new PartitionGarbageCollector(partitionStore, blobStore, contentCache, partitionLocks, clock,
        configuration.getValueAsLong(GlobalConfiguration.MAINTENANCE_RETIRED_GRACE_PERIOD));
    this.maintenanceTask = new MaintenanceTask(deduplicator, schemaRetirement, collector, metadataStore, partitionStore, metadataCache, clock,
        configuration);

    final PartitionScanner scanner = new PartitionScanner(partitionReader);
    this.catalog = new LakehouseCatalog(registry, metadataCache, jitGenerator, scanner);
    this.functions = new LakehouseFunctions(registry, partitionStore, metadataCache, deduplicator, scheduler, maintenanceTask, clock);

    LogManager.instance().log(this, Level.INFO, "Lakehouse opened with %d views", null, registry.size());
  }

  public static Builder builder() {
    return new Builder();
  }

  private static BlobStore createBlobStore(final ContextConfiguration configuration) {
    final String path = configuration.getValueAsString(GlobalConfiguration.STORAGE_PATH);
    if (path == null || path.isEmpty())
      return new InMemoryBlobStore();
    return new FileSystemBlobStore(Paths.get(path));
  }

  /**
   * Starts the scheduled materializer and the maintenance task.
   */
  public synchronized void start() {
    checkOpen();
    if (started)
      return;
    scheduler.start();
    maintenanceTask.start();
    started = true;
  }

  /**
   * Registers a process. A process already registered is left untouched.
   *
   * @return false if the process was already registered
   */
  public boolean insertProcess(final ProcessInfo process) {
    checkOpen();
    try {
      metadataStore.insertProcess(process);
      return true;
    } catch (final DuplicatedKeyException e) {
      LogManager.instance().log(this, Level.FINE, "Process %s already registered", null, process.getProcessId());
      return false;
    }
  }

  /**
   * @return false if the stream was already registered
   */
  public boolean insertStream(final StreamInfo stream) {
    checkOpen();
    try {
      metadataStore.insertStream(stream);
      return true;
    } catch (final DuplicatedKeyException e) {
      LogManager.instance().log(this, Level.FINE, "Stream %s already registered", null, stream.getStreamId());
      return false;
    }
  }

  /**
   * Stores the payload of the block, then registers its envelope. The block becomes visible to the materializers when its
   * registration commits. A stored payload is never replaced: a resubmitted block keeps the payload of its first
   * submission, whatever the content sent again.
   *
   * @return false if the block was already registered
   *
   * @throws LakehouseIsClosedException if the lakehouse is closed
   */
  public boolean insertBlock(final BlockMetadata block, final byte[] payload) {
    checkOpen();
    final ReentrantLock lock = blockLocks.get(block.getBlockId());
    lock.lock();
    try {
      if (metadataStore.getBlock(block.getBlockId()) != null) {
        LogManager.instance().log(this, Level.FINE, "Block %s already registered", null, block.getBlockId());
        return false;
      }

      final String path = block.getPayloadPath();
      if (blobStore.exists(path))
        // PREVIOUS SUBMISSION STORED THE PAYLOAD BUT FAILED TO REGISTER THE BLOCK
        LogManager.instance().log(this, Level.FINE, "Payload of block %s already stored, keeping it", null, block.getBlockId());
      else
        blobStore.put(path, payload);

      try {
        metadataStore.insertBlock(block);
        return true;
      } catch (final DuplicatedKeyException e) {
        LogManager.instance().log(this, Level.FINE, "Block %s already registered", null, block.getBlockId());
        return false;
      }
    } finally {
      lock.unlock();
    }
  }

  public void registerView(final ViewDefinition view) {
    registry.register(view);
  }

  /**
   * Replaces a view definition. Partitions written under the previous fingerprint are retired at the next maintenance
   * pass.
   */
  public ViewDefinition replaceView(final ViewDefinition view) {
    final ViewDefinition previous = registry.replace(view);
    metadataCache.invalidateView(view.getName());
    return previous;
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  public Clock getClock() {
    return clock;
  }

  public MetadataStore getMetadataStore() {
    return metadataStore;
  }

  public PartitionStore getPartitionStore() {
    return partitionStore;
  }

  public BlobStore getBlobStore() {
    return blobStore;
  }

  public PartitionLocks getPartitionLocks() {
    return partitionLocks;
  }

  public ContentCache getContentCache() {
    return contentCache;
  }

  public PartitionMetadataCache getMetadataCache() {
    return metadataCache;
  }

  public ViewRegistry getRegistry() {
    return registry;
  }

  public PartitionMaterializer getMaterializer() {
    return materializer;
  }

  public JitPartitionGenerator getJitGenerator() {
    return jitGenerator;
  }

  public MaterializerScheduler getScheduler() {
    return scheduler;
  }

  public Deduplicator getDeduplicator() {
    return deduplicator;
  }

  public SchemaRetirement getSchemaRetirement() {
    return schemaRetirement;
  }

  public MaintenanceTask getMaintenanceTask() {
    return maintenanceTask;
  }

  public LakehouseCatalog getCatalog() {
    return catalog;
  }

  public LakehouseFunctions getFunctions() {
    return functions;
  }

  public synchronized boolean isOpen() {
    return !closed;
  }

  private void checkOpen() {
    if (closed)
      throw new LakehouseIsClosedException();
  }

  @Override
  public synchronized void close() {
    if (closed)
      return;
    closed = true;
    scheduler.shutdown();
    maintenanceTask.shutdown();
    jitExecutor.shutdownNow();
    contentCache.invalidateAll();
    metadataCache.invalidateAll();
    dataSource.close();
    LogManager.instance().log(this, Level.INFO, "Lakehouse closed", null);
  }

  public static class Builder {
    private       ContextConfiguration configuration = new ContextConfiguration();
    private       Clock                clock         = Clock.systemUTC();
    private       BlobStore            blobStore;
    private       boolean              builtinViews  = true;
    private final List<ViewDefinition> views         = new ArrayList<>();

    public Builder configuration(final ContextConfiguration configuration) {
      this.configuration = configuration;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Object storage to use instead of the one configured by {@link GlobalConfiguration#STORAGE_PATH}.
     */
    public Builder blobStore(final BlobStore blobStore) {
      this.blobStore = blobStore;
      return this;
    }

    public Builder builtinViews(final boolean builtinViews) {
      this.builtinViews = builtinViews;
      return this;
    }

    public Builder view(final ViewDefinition view) {
      views.add(view);
      return this;
    }

    public Lakehouse build() {
      return new Lakehouse(this);
    }
  }
}
