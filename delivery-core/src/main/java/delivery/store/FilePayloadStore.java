package delivery.store;

import com.github.f4b6a3.ulid.Ulid;
import delivery.DeliveryError;
import delivery.ErrorSink;
import delivery.ResourceType;
import delivery.model.Payload;
import delivery.spi.MetricsExporter;
import delivery.spi.PayloadStore;
import delivery.truncate.QueueTruncator;
import delivery.util.DaemonThreadFactory;
import delivery.util.JsonCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * {@link PayloadStore} keeping one JSON file per payload under
 * {@code <root>/<resourceId>/}. The directory listing is the queue.
 *
 * <p>Every write goes to a sibling {@code *.tmp} file with synchronous I/O and is then
 * renamed over its target, so a crash leaves either the old record or the new one, never
 * a partial file. Leftover temp files are deleted the first time a resource type is
 * initialised.
 *
 * <p>Each successful {@link #enqueue} triggers an asynchronous {@link QueueTruncator}
 * pass that keeps the queue within {@code maxItems}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; it assumes it is
 * the only process using its root directory.
 */
public final class FilePayloadStore implements PayloadStore, AutoCloseable {
  private static final Logger logger = Logger.getLogger(FilePayloadStore.class.getName());

  static final String TMP_SUFFIX = ".tmp";
  static final String HIGH_WATER_FILE = ".high-water";

  private final Path root;
  private final ErrorSink errorSink;
  private final MetricsExporter metrics;
  private final PayloadRecordCodec codec;
  private final Clock clock;
  private final int maxItems;
  private final ExecutorService ownedExecutor;
  private final QueueTruncator truncator;

  private final MonotonicIdGenerator ids = new MonotonicIdGenerator();
  private final Set<ResourceType> initialized = ConcurrentHashMap.newKeySet();
  private final Map<ResourceType, Object> locks = new EnumMap<>(ResourceType.class);
  private final Map<ResourceType, Ulid> persistedHighWater = new EnumMap<>(ResourceType.class);

  private FilePayloadStore(Builder builder) {
    this.root = Objects.requireNonNull(builder.root, "root");
    if (builder.maxItems < 1) {
      throw new IllegalArgumentException("maxItems must be >= 1");
    }
    this.maxItems = builder.maxItems;
    this.errorSink = ErrorSink.guarded(builder.errorSink);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.codec = new PayloadRecordCodec(
        builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault());
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    for (ResourceType type : ResourceType.values()) {
      locks.put(type, new Object());
    }

    Executor executor = builder.truncationExecutor;
    if (executor == null) {
      this.ownedExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("delivery-truncate-"));
      executor = ownedExecutor;
    } else {
      this.ownedExecutor = null;
    }
    this.truncator = new QueueTruncator(this, maxItems, executor, errorSink, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Path root() {
    return root;
  }

  public int maxItems() {
    return maxItems;
  }

  /**
   * Returns the truncator bound to this store, e.g. to run a synchronous pass.
   *
   * @return the truncator
   */
  public QueueTruncator truncator() {
    return truncator;
  }

  @Override
  public boolean init(ResourceType type) {
    Objects.requireNonNull(type, "type");
    Path dir = directory(type);
    if (initialized.contains(type) && Files.isDirectory(dir)) {
      return true;
    }
    synchronized (lock(type)) {
      try {
        Files.createDirectories(dir);
      } catch (IOException | RuntimeException e) {
        report(DeliveryError.Kind.STORAGE_FAILURE, type, null,
            "Failed to create queue directory " + dir, e);
        return false;
      }
      if (!initialized.contains(type)) {
        // published only after cleanup and seeding; the fast path above skips the lock
        deleteTempFiles(type, dir);
        ids.seed(type, highWater(type, dir));
        initialized.add(type);
      }
      return true;
    }
  }

  @Override
  public String enqueue(ResourceType type, byte[] body, Map<String, String> headers) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(body, "body");
    if (!init(type)) {
      metrics.incrementEnqueueFailed(type);
      return null;
    }
    Ulid ulid = ids.next(type);
    String id = PayloadIds.format(type, ulid);
    try {
      String json = codec.toJson(codec.newRecord(type, clock.instant(), headers, body));
      writeAtomically(file(type, id), json);
    } catch (IOException | RuntimeException e) {
      report(DeliveryError.Kind.STORAGE_FAILURE, type, id, "Failed to enqueue payload", e);
      metrics.incrementEnqueueFailed(type);
      return null;
    }
    persistHighWater(type, ulid);
    metrics.incrementEnqueued(type);
    truncator.trigger(type);
    return id;
  }

  @Override
  public Payload peek(ResourceType type) {
    Objects.requireNonNull(type, "type");
    // Iterate over a snapshot: each corrupt entry is deleted and the next-oldest tried,
    // so the loop is bounded by the queue length observed here.
    for (String id : list(type)) {
      String json;
      try {
        json = Files.readString(file(type, id), StandardCharsets.UTF_8);
      } catch (NoSuchFileException e) {
        continue; // removed concurrently (truncation or a settled delivery)
      } catch (IOException e) {
        healCorrupt(type, id, "Unreadable payload record", e);
        continue;
      }
      try {
        return codec.toPayload(id, type, codec.parse(json));
      } catch (IllegalArgumentException | DateTimeException e) {
        healCorrupt(type, id, "Undecodable payload record", e);
      }
    }
    return null;
  }

  @Override
  public void remove(String id) {
    ResourceType type = resourceOf(id);
    if (type == null || !init(type)) {
      return;
    }
    synchronized (lock(type)) {
      try {
        Files.deleteIfExists(file(type, id));
      } catch (IOException | RuntimeException e) {
        report(DeliveryError.Kind.STORAGE_FAILURE, type, id, "Failed to remove payload", e);
      }
    }
  }

  @Override
  public boolean update(String id, Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields");
    ResourceType type = resourceOf(id);
    if (type == null || !init(type)) {
      return false;
    }
    synchronized (lock(type)) {
      Path file = file(type, id);
      String json;
      try {
        json = Files.readString(file, StandardCharsets.UTF_8);
      } catch (NoSuchFileException e) {
        report(DeliveryError.Kind.MISSING_ENTRY, type, id, "Cannot update a payload that no longer exists", e);
        return false;
      } catch (IOException e) {
        report(DeliveryError.Kind.STORAGE_FAILURE, type, id, "Failed to read payload for update", e);
        return false;
      }

      String updatedJson;
      try {
        Map<String, Object> current = codec.parse(json);
        Map<String, Object> merged = new LinkedHashMap<>(current);
        merged.putAll(fields);
        int before = PayloadRecordCodec.retries(current);
        int after = PayloadRecordCodec.retries(merged);
        if (after < before) {
          report(DeliveryError.Kind.INVALID_UPDATE, type, id,
              "retries cannot decrease (" + before + " -> " + after + ")", null);
          return false;
        }
        updatedJson = codec.toJson(merged);
        codec.toPayload(id, type, codec.parse(updatedJson));
      } catch (IllegalArgumentException | DateTimeException e) {
        report(DeliveryError.Kind.INVALID_UPDATE, type, id, "Update would leave an undecodable record", e);
        return false;
      }

      try {
        writeAtomically(file, updatedJson);
        return true;
      } catch (IOException | RuntimeException e) {
        report(DeliveryError.Kind.STORAGE_FAILURE, type, id, "Failed to rewrite payload", e);
        return false;
      }
    }
  }

  @Override
  public List<String> list(ResourceType type) {
    Objects.requireNonNull(type, "type");
    if (!init(type)) {
      return List.of();
    }
    List<String> result = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory(type))) {
      files.forEach(p -> {
        String id = PayloadIds.idFromFileName(p.getFileName().toString());
        if (id != null) {
          result.add(id);
        }
      });
    } catch (IOException | UncheckedIOException e) {
      report(DeliveryError.Kind.STORAGE_FAILURE, type, null, "Failed to list queue", e);
      return List.of();
    }
    Collections.sort(result);
    return result;
  }

  /**
   * Shuts down the truncation executor if this store created it.
   */
  @Override
  public void close() {
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        ownedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private Path directory(ResourceType type) {
    return root.resolve(type.id());
  }

  private Path file(ResourceType type, String id) {
    return directory(type).resolve(PayloadIds.fileName(id));
  }

  private Object lock(ResourceType type) {
    return locks.get(type);
  }

  private ResourceType resourceOf(String id) {
    try {
      return PayloadIds.resourceOf(id);
    } catch (IllegalArgumentException | NullPointerException e) {
      report(DeliveryError.Kind.STORAGE_FAILURE, null, id, "Malformed payload id", e);
      return null;
    }
  }

  private void healCorrupt(ResourceType type, String id, String message, Exception cause) {
    report(DeliveryError.Kind.CORRUPT_ENTRY, type, id, message + "; deleting it", cause);
    metrics.incrementCorruptRemoved(type);
    remove(id);
  }

  private void deleteTempFiles(ResourceType type, Path dir) {
    try (Stream<Path> files = Files.list(dir)) {
      for (Path p : (Iterable<Path>) files::iterator) {
        if (p.getFileName().toString().endsWith(TMP_SUFFIX)) {
          Files.deleteIfExists(p);
          logger.log(Level.FINE, "Deleted interrupted write {0}", p);
        }
      }
    } catch (IOException | UncheckedIOException e) {
      report(DeliveryError.Kind.STORAGE_FAILURE, type, null, "Failed to clean temp files in " + dir, e);
    }
  }

  private Ulid highWater(ResourceType type, Path dir) {
    Ulid highest = null;
    Path marker = dir.resolve(HIGH_WATER_FILE);
    try {
      if (Files.exists(marker)) {
        String stored = Files.readString(marker, StandardCharsets.UTF_8).trim();
        if (Ulid.isValid(stored)) {
          highest = Ulid.from(stored);
        } else {
          logger.log(Level.WARNING, "Ignoring malformed high-water mark in {0}", marker);
        }
      }
    } catch (IOException e) {
      report(DeliveryError.Kind.STORAGE_FAILURE, type, null, "Failed to read high-water mark", e);
    }
    List<String> queued = list(type);
    if (!queued.isEmpty()) {
      Ulid newest = PayloadIds.ulidOf(queued.get(queued.size() - 1));
      if (highest == null || newest.compareTo(highest) > 0) {
        highest = newest;
      }
    }
    synchronized (persistedHighWater) {
      if (highest != null) {
        persistedHighWater.put(type, highest);
      }
    }
    return highest;
  }

  private void persistHighWater(ResourceType type, Ulid ulid) {
    synchronized (persistedHighWater) {
      Ulid current = persistedHighWater.get(type);
      if (current != null && current.compareTo(ulid) >= 0) {
        return;
      }
      try {
        writeAtomically(directory(type).resolve(HIGH_WATER_FILE), ulid.toString());
        persistedHighWater.put(type, ulid);
      } catch (IOException e) {
        // the queued file names still carry the order; only a later empty-queue restart loses it
        report(DeliveryError.Kind.STORAGE_FAILURE, type, null, "Failed to persist high-water mark", e);
      }
    }
  }

  private static void writeAtomically(Path target, String content) throws IOException {
    Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
    Files.writeString(tmp, content, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE, StandardOpenOption.SYNC);
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void report(DeliveryError.Kind kind, ResourceType type, String id, String message, Throwable cause) {
    errorSink.report(new DeliveryError(kind, type, id, message, cause));
  }

  /** Builder for {@link FilePayloadStore}. */
  public static final class Builder {
    private Path root;
    private ErrorSink errorSink;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;
    private Executor truncationExecutor;
    private int maxItems = QueueTruncator.DEFAULT_MAX_ITEMS;

    private Builder() {}

    /**
     * Sets the root directory; each resource type gets a subdirectory.
     *
     * <p><b>Required.</b>
     *
     * @param root the root directory
     * @return this builder
     */
    public Builder root(Path root) {
      this.root = root;
      return this;
    }

    /**
     * Sets the sink receiving storage failures and corrupt-entry reports.
     *
     * <p>Optional. Defaults to {@link ErrorSink#LOGGING}.
     *
     * @param errorSink the error sink
     * @return this builder
     */
    public Builder errorSink(ErrorSink errorSink) {
      this.errorSink = errorSink;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the codec used for record files.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the JSON codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the clock stamping {@code createdAt}.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the executor running truncation passes.
     *
     * <p>Optional. Defaults to a single daemon thread owned (and closed) by the store.
     *
     * @param truncationExecutor the executor
     * @return this builder
     */
    public Builder truncationExecutor(Executor truncationExecutor) {
      this.truncationExecutor = truncationExecutor;
      return this;
    }

    /**
     * Sets the per-resource-type capacity bound.
     *
     * <p>Optional. Defaults to {@code 64}. Must be &ge; 1.
     *
     * @param maxItems maximum queued payloads per resource type
     * @return this builder
     */
    public Builder maxItems(int maxItems) {
      this.maxItems = maxItems;
      return this;
    }

    /**
     * Builds the store. Directories are created lazily on first use.
     *
     * @return a new {@link FilePayloadStore}
     * @throws NullPointerException if {@code root} is null
     * @throws IllegalArgumentException if {@code maxItems < 1}
     */
    public FilePayloadStore build() {
      return new FilePayloadStore(this);
    }
  }
}
