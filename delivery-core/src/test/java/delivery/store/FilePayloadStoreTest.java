package delivery.store;

import com.github.f4b6a3.ulid.Ulid;
import delivery.DeliveryError;
import delivery.RecordingErrorSink;
import delivery.ResourceType;
import delivery.model.Payload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FilePayloadStoreTest {

  @TempDir
  Path root;

  private final RecordingErrorSink sink = new RecordingErrorSink();
  private final List<FilePayloadStore> opened = new ArrayList<>();

  @AfterEach
  void tearDown() {
    opened.forEach(FilePayloadStore::close);
  }

  private FilePayloadStore newStore() {
    return newStore(64);
  }

  private FilePayloadStore newStore(int maxItems) {
    FilePayloadStore store = FilePayloadStore.builder()
        .root(root)
        .maxItems(maxItems)
        .errorSink(sink)
        .truncationExecutor(Runnable::run)
        .build();
    opened.add(store);
    return store;
  }

  private Path fileOf(String id) {
    return root.resolve(PayloadIds.resourceOf(id).id()).resolve(PayloadIds.fileName(id));
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  // ── FIFO ──────────────────────────────────────────────────────

  @Test
  void peekReturnsOldestPayload() {
    FilePayloadStore store = newStore();
    String first = store.enqueue(ResourceType.ERRORS, bytes("{\"n\":1}"), Map.of("Api-Key", "k1"));
    store.enqueue(ResourceType.ERRORS, bytes("{\"n\":2}"));

    Payload head = store.peek(ResourceType.ERRORS);

    assertNotNull(head);
    assertEquals(first, head.id());
    assertEquals(ResourceType.ERRORS, head.resourceType());
    assertArrayEquals(bytes("{\"n\":1}"), head.body());
    assertEquals(Map.of("Api-Key", "k1"), head.headers());
    assertEquals(0, head.retries());
    assertNotNull(head.createdAt());
  }

  @Test
  void listPreservesEnqueueOrder() {
    FilePayloadStore store = newStore(500);
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      ids.add(store.enqueue(ResourceType.SESSIONS, bytes("s" + i)));
    }

    assertEquals(ids, store.list(ResourceType.SESSIONS));
    assertEquals(200, store.size(ResourceType.SESSIONS));
  }

  @Test
  void idsCarryResourceType() {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.SESSIONS, bytes("x"));

    assertTrue(id.startsWith("sessions-"));
    assertTrue(PayloadIds.isValid(id));
    assertTrue(Files.exists(fileOf(id)));
  }

  @Test
  void resourceTypesAreIndependent() {
    FilePayloadStore store = newStore();
    String error = store.enqueue(ResourceType.ERRORS, bytes("e"));
    String session = store.enqueue(ResourceType.SESSIONS, bytes("s"));

    assertEquals(error, store.peek(ResourceType.ERRORS).id());
    assertEquals(session, store.peek(ResourceType.SESSIONS).id());
    assertEquals(List.of(error), store.list(ResourceType.ERRORS));
  }

  @Test
  void peekOnEmptyQueueReturnsNull() {
    FilePayloadStore store = newStore();
    assertNull(store.peek(ResourceType.ERRORS));
    assertTrue(store.list(ResourceType.ERRORS).isEmpty());
  }

  @Test
  void bodyIsCopied() {
    FilePayloadStore store = newStore();
    byte[] body = bytes("abc");
    store.enqueue(ResourceType.ERRORS, body);
    body[0] = 'z';

    Payload head = store.peek(ResourceType.ERRORS);
    assertArrayEquals(bytes("abc"), head.body());
  }

  // ── Capacity bound ────────────────────────────────────────────

  @Test
  void queueIsBoundedByEvictingOldest() {
    FilePayloadStore store = newStore();
    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 70; i++) {
      ids.add(store.enqueue(ResourceType.ERRORS, bytes("e" + i)));
    }

    List<String> queued = store.list(ResourceType.ERRORS);
    assertEquals(64, queued.size());
    assertEquals(ids.subList(6, 70), queued);
    assertEquals(ids.get(6), store.peek(ResourceType.ERRORS).id());
  }

  @Test
  void boundIsPerResourceType() {
    FilePayloadStore store = newStore(2);
    for (int i = 0; i < 5; i++) {
      store.enqueue(ResourceType.ERRORS, bytes("e" + i));
    }
    store.enqueue(ResourceType.SESSIONS, bytes("s"));

    assertEquals(2, store.size(ResourceType.ERRORS));
    assertEquals(1, store.size(ResourceType.SESSIONS));
  }

  @Test
  void maxItemsMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> FilePayloadStore.builder().root(root).maxItems(0).build());
    assertThrows(NullPointerException.class, () -> FilePayloadStore.builder().build());
  }

  // ── Self-healing peek ─────────────────────────────────────────

  @Test
  void corruptHeadIsDeletedAndNextReturned() throws Exception {
    FilePayloadStore store = newStore();
    String corrupt = store.enqueue(ResourceType.ERRORS, bytes("one"));
    String good = store.enqueue(ResourceType.ERRORS, bytes("two"));
    Files.writeString(fileOf(corrupt), "not json");

    Payload head = store.peek(ResourceType.ERRORS);

    assertEquals(good, head.id());
    assertFalse(Files.exists(fileOf(corrupt)));
    assertEquals(List.of(good), store.list(ResourceType.ERRORS));
    List<DeliveryError> reports = sink.ofKind(DeliveryError.Kind.CORRUPT_ENTRY);
    assertEquals(1, reports.size());
    assertEquals(corrupt, reports.get(0).payloadId());
  }

  @Test
  void recordWithInvalidFieldsIsCorrupt() throws Exception {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("one"));
    Files.writeString(fileOf(id),
        "{\"resourceType\":\"errors\",\"createdAt\":\"yesterday\",\"retries\":0,\"body\":\"b25l\"}");

    assertNull(store.peek(ResourceType.ERRORS));
    assertTrue(store.list(ResourceType.ERRORS).isEmpty());
    assertEquals(1, sink.ofKind(DeliveryError.Kind.CORRUPT_ENTRY).size());
  }

  @Test
  void allCorruptQueueYieldsNull() throws Exception {
    FilePayloadStore store = newStore();
    for (int i = 0; i < 3; i++) {
      Files.writeString(fileOf(store.enqueue(ResourceType.SESSIONS, bytes("s"))), "{");
    }

    assertNull(store.peek(ResourceType.SESSIONS));
    assertEquals(3, sink.ofKind(DeliveryError.Kind.CORRUPT_ENTRY).size());
  }

  @Test
  void foreignFilesAreIgnored() throws Exception {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("x"));
    Files.writeString(root.resolve("errors").resolve("notes.txt"), "hello");

    assertEquals(List.of(id), store.list(ResourceType.ERRORS));
  }

  // ── Remove ────────────────────────────────────────────────────

  @Test
  void removeIsIdempotent() {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("x"));

    store.remove(id);
    store.remove(id);

    assertNull(store.peek(ResourceType.ERRORS));
    assertTrue(sink.errors().isEmpty());
  }

  @Test
  void removeMalformedIdReportsWithoutThrowing() {
    FilePayloadStore store = newStore();

    assertDoesNotThrow(() -> store.remove("../../etc/passwd"));
    assertEquals(1, sink.ofKind(DeliveryError.Kind.STORAGE_FAILURE).size());
  }

  // ── Update ────────────────────────────────────────────────────

  @Test
  void updateRewritesRetriesInPlace() {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("x"), Map.of("h", "v"));
    store.enqueue(ResourceType.ERRORS, bytes("y"));

    assertTrue(store.update(id, Map.of("retries", 1)));
    assertTrue(store.update(id, Map.of("retries", 2)));

    Payload head = store.peek(ResourceType.ERRORS);
    assertEquals(id, head.id());
    assertEquals(2, head.retries());
    assertArrayEquals(bytes("x"), head.body());
    assertEquals(Map.of("h", "v"), head.headers());
  }

  @Test
  void updateRejectsDecreasingRetries() {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("x"));
    store.update(id, Map.of("retries", 3));

    assertFalse(store.update(id, Map.of("retries", 1)));

    assertEquals(3, store.peek(ResourceType.ERRORS).retries());
    assertEquals(1, sink.ofKind(DeliveryError.Kind.INVALID_UPDATE).size());
  }

  @Test
  void updateRejectsUndecodableResult() {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("x"));

    assertFalse(store.update(id, Map.of("createdAt", "not-a-timestamp")));
    assertFalse(store.update(id, Map.of("retries", "many")));

    assertEquals(0, store.peek(ResourceType.ERRORS).retries());
    assertEquals(2, sink.ofKind(DeliveryError.Kind.INVALID_UPDATE).size());
  }

  @Test
  void updateOfMissingEntryIsReported() {
    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.ERRORS, bytes("x"));
    store.remove(id);

    assertFalse(store.update(id, Map.of("retries", 1)));

    assertNull(store.peek(ResourceType.ERRORS));
    List<DeliveryError> reports = sink.ofKind(DeliveryError.Kind.MISSING_ENTRY);
    assertEquals(1, reports.size());
    assertEquals(id, reports.get(0).payloadId());
  }

  // ── Crash resume ──────────────────────────────────────────────

  @Test
  void newStoreResumesExistingQueue() {
    FilePayloadStore first = newStore();
    String a = first.enqueue(ResourceType.ERRORS, bytes("a"));
    String b = first.enqueue(ResourceType.ERRORS, bytes("b"));
    first.update(a, Map.of("retries", 4));
    first.close();

    FilePayloadStore second = newStore();

    assertEquals(List.of(a, b), second.list(ResourceType.ERRORS));
    Payload head = second.peek(ResourceType.ERRORS);
    assertEquals(a, head.id());
    assertEquals(4, head.retries());

    String c = second.enqueue(ResourceType.ERRORS, bytes("c"));
    assertTrue(c.compareTo(b) > 0);
    assertEquals(List.of(a, b, c), second.list(ResourceType.ERRORS));
  }

  @Test
  void interruptedWritesAreCleanedOnInit() throws Exception {
    Path dir = Files.createDirectories(root.resolve("errors"));
    Path tmp = dir.resolve("delivery-errors-01ARZ3NDEKTSV4RRFFQ69G5FAV.json.tmp");
    Files.writeString(tmp, "{\"resour");

    FilePayloadStore store = newStore();

    assertTrue(store.list(ResourceType.ERRORS).isEmpty());
    assertFalse(Files.exists(tmp));
  }

  @Test
  void concurrentFirstEnqueuesSurviveStartupCleanup() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      for (int round = 0; round < 50; round++) {
        Path roundRoot = root.resolve("round-" + round);
        Path dir = Files.createDirectories(roundRoot.resolve("errors"));
        for (int i = 0; i < 50; i++) {
          Files.writeString(dir.resolve("leftover-" + i + ".json.tmp"), "{\"resour");
        }
        Ulid future = new Ulid(System.currentTimeMillis() + 86_400_000L, new byte[10]);
        Files.writeString(dir.resolve(FilePayloadStore.HIGH_WATER_FILE), future.toString());
        FilePayloadStore store = FilePayloadStore.builder()
            .root(roundRoot)
            .errorSink(sink)
            .truncationExecutor(Runnable::run)
            .build();
        opened.add(store);

        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
          byte[] body = bytes("payload-" + t);
          results.add(pool.submit(() -> {
            start.await();
            return store.enqueue(ResourceType.ERRORS, body);
          }));
        }
        start.countDown();

        Set<String> ids = new HashSet<>();
        for (Future<String> result : results) {
          String id = result.get(10, TimeUnit.SECONDS);
          assertNotNull(id, "enqueue lost a payload in round " + round);
          assertTrue(PayloadIds.ulidOf(id).compareTo(future) > 0, "id below high-water mark: " + id);
          ids.add(id);
        }
        assertEquals(threads, ids.size());
        assertEquals(threads, store.list(ResourceType.ERRORS).size());
      }
      assertEquals(List.of(), sink.ofKind(DeliveryError.Kind.STORAGE_FAILURE));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void idsStayMonotonicAfterRestartWithEmptyQueue() throws Exception {
    Path dir = Files.createDirectories(root.resolve("sessions"));
    Ulid future = new Ulid(System.currentTimeMillis() + 86_400_000L, new byte[10]);
    Files.writeString(dir.resolve(FilePayloadStore.HIGH_WATER_FILE), future.toString());

    FilePayloadStore store = newStore();
    String id = store.enqueue(ResourceType.SESSIONS, bytes("s"));

    assertTrue(PayloadIds.ulidOf(id).compareTo(future) > 0);
  }

  @Test
  void highWaterMarkIsPersisted() throws Exception {
    FilePayloadStore first = newStore();
    String id = first.enqueue(ResourceType.ERRORS, bytes("a"));
    first.remove(id);
    first.close();

    String stored = Files.readString(root.resolve("errors").resolve(FilePayloadStore.HIGH_WATER_FILE)).trim();
    assertEquals(PayloadIds.ulidOf(id).toString(), stored);

    FilePayloadStore second = newStore();
    String next = second.enqueue(ResourceType.ERRORS, bytes("b"));
    assertTrue(next.compareTo(id) > 0);
  }

  // ── Storage failures ──────────────────────────────────────────

  @Test
  void unusableRootReportsAndReturnsNull() throws Exception {
    Path file = Files.writeString(root.resolve("plain-file"), "x");
    FilePayloadStore store = FilePayloadStore.builder()
        .root(file)
        .errorSink(sink)
        .truncationExecutor(Runnable::run)
        .build();
    opened.add(store);

    assertNull(store.enqueue(ResourceType.ERRORS, bytes("x")));
    assertNull(store.peek(ResourceType.ERRORS));
    assertFalse(store.init(ResourceType.ERRORS));
    assertFalse(sink.ofKind(DeliveryError.Kind.STORAGE_FAILURE).isEmpty());
  }
}
