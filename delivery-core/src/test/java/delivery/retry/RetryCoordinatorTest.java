package delivery.retry;

import delivery.DeliveryError;
import delivery.DeliveryOutcome;
import delivery.RecordingErrorSink;
import delivery.ResourceType;
import delivery.model.Payload;
import delivery.store.FilePayloadStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryCoordinatorTest {

  @TempDir
  Path root;

  private final RecordingErrorSink sink = new RecordingErrorSink();
  private FilePayloadStore store;

  @BeforeEach
  void setUp() {
    store = FilePayloadStore.builder()
        .root(root)
        .errorSink(sink)
        .truncationExecutor(Runnable::run)
        .build();
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void successRemovesPayload() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    store.enqueue(ResourceType.ERRORS, new byte[]{1});

    RetryDecision decision = coordinator.settle(store.peek(ResourceType.ERRORS), DeliveryOutcome.success());

    assertEquals(RetryDecision.DELIVERED, decision);
    assertTrue(decision.removed());
    assertNull(store.peek(ResourceType.ERRORS));
    assertTrue(sink.errors().isEmpty());
  }

  @Test
  void retryableFailureIncrementsRetriesInPlace() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    String id = store.enqueue(ResourceType.ERRORS, new byte[]{1});
    store.enqueue(ResourceType.ERRORS, new byte[]{2});

    for (int expected = 1; expected <= 3; expected++) {
      Payload head = store.peek(ResourceType.ERRORS);
      RetryDecision decision = coordinator.settle(head, DeliveryOutcome.retryable("HTTP 503"));

      assertEquals(RetryDecision.RETAINED, decision);
      assertFalse(decision.removed());
      Payload after = store.peek(ResourceType.ERRORS);
      assertEquals(id, after.id());
      assertEquals(expected, after.retries());
    }
    assertTrue(sink.errors().isEmpty());
  }

  @Test
  void permanentFailureRemovesAndReportsOnce() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    String id = store.enqueue(ResourceType.SESSIONS, new byte[]{1});

    RetryDecision decision = coordinator.settle(store.peek(ResourceType.SESSIONS),
        DeliveryOutcome.permanent("HTTP 400"));

    assertEquals(RetryDecision.DISCARDED, decision);
    assertNull(store.peek(ResourceType.SESSIONS));
    assertEquals(1, sink.errors().size());
    DeliveryError error = sink.errors().get(0);
    assertEquals(DeliveryError.Kind.DELIVERY_PERMANENT, error.kind());
    assertEquals(id, error.payloadId());
    assertEquals(ResourceType.SESSIONS, error.resourceType());
    assertTrue(error.message().contains("HTTP 400"));
  }

  @Test
  void retriesAreUnboundedByDefault() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    store.enqueue(ResourceType.ERRORS, new byte[]{1});

    for (int i = 0; i < 20; i++) {
      assertEquals(RetryDecision.RETAINED,
          coordinator.settle(store.peek(ResourceType.ERRORS), DeliveryOutcome.retryable("offline")));
    }
    assertEquals(20, store.peek(ResourceType.ERRORS).retries());
  }

  @Test
  void exhaustedRetriesDiscardPayload() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink, null, 2);
    String id = store.enqueue(ResourceType.ERRORS, new byte[]{1});

    assertEquals(RetryDecision.RETAINED,
        coordinator.settle(store.peek(ResourceType.ERRORS), DeliveryOutcome.retryable("offline")));
    assertEquals(RetryDecision.RETAINED,
        coordinator.settle(store.peek(ResourceType.ERRORS), DeliveryOutcome.retryable("offline")));
    assertEquals(RetryDecision.EXHAUSTED,
        coordinator.settle(store.peek(ResourceType.ERRORS), DeliveryOutcome.retryable("offline")));

    assertNull(store.peek(ResourceType.ERRORS));
    assertEquals(1, sink.ofKind(DeliveryError.Kind.RETRIES_EXHAUSTED).size());
    assertEquals(id, sink.errors().get(0).payloadId());
  }

  @Test
  void attemptClassifiesThrowingTransportAsRetryable() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    store.enqueue(ResourceType.ERRORS, new byte[]{1});
    Payload head = store.peek(ResourceType.ERRORS);

    DeliveryOutcome outcome = coordinator.attempt(payload -> {
      throw new IllegalStateException("socket closed");
    }, head);

    assertInstanceOf(DeliveryOutcome.RetryableFailure.class, outcome);
    assertTrue(((DeliveryOutcome.RetryableFailure) outcome).reason().contains("socket closed"));
  }

  @Test
  void attemptClassifiesNullOutcomeAsRetryable() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    store.enqueue(ResourceType.ERRORS, new byte[]{1});

    DeliveryOutcome outcome = coordinator.attempt(payload -> null, store.peek(ResourceType.ERRORS));

    assertInstanceOf(DeliveryOutcome.RetryableFailure.class, outcome);
  }

  @Test
  void attemptPassesThroughTransportOutcome() {
    RetryCoordinator coordinator = new RetryCoordinator(store, sink);
    store.enqueue(ResourceType.ERRORS, new byte[]{1});
    DeliveryOutcome expected = DeliveryOutcome.retryable("HTTP 429", Duration.ofSeconds(3));

    assertSame(expected, coordinator.attempt(payload -> expected, store.peek(ResourceType.ERRORS)));
  }

  @Test
  void negativeMaxRetriesRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryCoordinator(store, sink, null, -1));
    assertThrows(NullPointerException.class, () -> new RetryCoordinator(null, sink));
  }

  @Test
  void outcomeValidation() {
    assertThrows(IllegalArgumentException.class,
        () -> DeliveryOutcome.retryable("x", Duration.ofSeconds(-1)));
    assertThrows(NullPointerException.class, () -> DeliveryOutcome.permanent(null));
    assertNull(DeliveryOutcome.retryable("x").retryAfter());
  }
}
