package com.acme.commanding.consumer;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.commanding.command.CommandResult;
import com.acme.commanding.command.CommandStatus;
import com.acme.commanding.core.AggregateRootAlreadyExistsException;
import com.acme.commanding.core.AggregateRootNotFoundException;
import com.acme.commanding.domain.AggregateRepository;
import com.acme.commanding.testsupport.Customer;
import com.acme.commanding.testsupport.Order;
import com.acme.commanding.testsupport.PlaceOrderCommand;
import com.acme.commanding.testsupport.TestMessages;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TrackingCommandContext Tests")
class TrackingCommandContextTest {

  private static final Instant STARTED_AT = Instant.parse("2025-01-01T00:00:00Z");

  @Mock private AggregateRepository repository;

  private CompletableFuture<CommandResult> completion;
  private TrackingCommandContext context;

  @BeforeEach
  void setUp() {
    completion = new CompletableFuture<>();
    context =
        new TrackingCommandContext(
            new PlaceOrderCommand("cmd-1", "order-1"),
            TestMessages.message(0),
            "command-results",
            Map.of("DomainEventHandledMessageTopic", "handled"),
            repository,
            completion,
            STARTED_AT);
  }

  @Nested
  @DisplayName("add")
  class AddTests {

    @Test
    @DisplayName("should track a new aggregate")
    void testAdd_TracksAggregate() {
      Order order = new Order("order-1");

      context.add(order);

      assertThat(context.getTrackedAggregateRoots()).containsExactly(order);
      assertThat(context.get(Order.class, "order-1")).isSameAs(order);
      verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("should reject a second aggregate with the same id and keep the first")
    void testAdd_DuplicateId() {
      Order first = new Order("order-1");
      Order second = new Order("order-1");
      context.add(first);

      assertThatThrownBy(() -> context.add(second))
          .isInstanceOf(AggregateRootAlreadyExistsException.class)
          .hasMessageContaining("order-1")
          .satisfies(
              e ->
                  assertThat(((AggregateRootAlreadyExistsException) e).getAggregateRootType())
                      .isEqualTo(Order.class));

      assertThat(context.getTrackedAggregateRoots()).containsExactly(first);
      assertThat(context.get(Order.class, "order-1")).isSameAs(first);
    }

    @Test
    @DisplayName("should reject null aggregate")
    void testAdd_Null() {
      assertThatThrownBy(() -> context.add(null)).isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("get")
  class GetTests {

    @Test
    @DisplayName("should load from repository once and return the same instance afterwards")
    void testGet_CachesLoadedAggregate() {
      Order order = new Order("order-9");
      when(repository.get(Order.class, "order-9")).thenReturn(Optional.of(order));

      Order first = context.get(Order.class, "order-9");
      Order second = context.get(Order.class, "order-9");

      assertThat(first).isSameAs(order);
      assertThat(second).isSameAs(first);
      verify(repository, times(1)).get(Order.class, "order-9");
      assertThat(context.getTrackedAggregateRoots()).containsExactly(order);
    }

    @Test
    @DisplayName("should see mutations made earlier in the same command")
    void testGet_MutationsAccumulate() {
      when(repository.get(Order.class, "order-9")).thenReturn(Optional.of(new Order("order-9")));

      context.get(Order.class, "order-9").cancel();

      assertThat(context.get(Order.class, "order-9").getStatus()).isEqualTo("CANCELLED");
    }

    @Test
    @DisplayName("should throw AggregateRootNotFoundException and leave tracked set unchanged")
    void testGet_NotFound() {
      Order tracked = new Order("order-1");
      context.add(tracked);
      when(repository.get(Order.class, "order-9")).thenReturn(Optional.empty());

      assertThatThrownBy(() -> context.get(Order.class, "order-9"))
          .isInstanceOf(AggregateRootNotFoundException.class)
          .hasMessageContaining("order-9")
          .hasMessageContaining(Order.class.getName());

      assertThat(context.getTrackedAggregateRoots()).containsExactly(tracked);
    }

    @Test
    @DisplayName("should reject null, empty and blank ids without touching the repository")
    void testGet_InvalidId() {
      assertThatThrownBy(() -> context.get(Order.class, null))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> context.get(Order.class, ""))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> context.get(Order.class, "  "))
          .isInstanceOf(IllegalArgumentException.class);

      verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("should treat a tracked aggregate of another type as not found")
    void testGet_TrackedWithOtherType() {
      context.add(new Customer("id-1"));

      assertThatThrownBy(() -> context.get(Order.class, "id-1"))
          .isInstanceOf(AggregateRootNotFoundException.class);
      verify(repository, never()).get(any(), anyString());
    }
  }

  @Nested
  @DisplayName("tracking")
  class TrackingTests {

    @Test
    @DisplayName("getTrackedAggregateRoots should return a snapshot")
    void testGetTracked_Snapshot() {
      context.add(new Order("order-1"));
      var snapshot = context.getTrackedAggregateRoots();

      context.add(new Order("order-2"));

      assertThat(snapshot).hasSize(1);
      assertThat(context.getTrackedAggregateRoots()).hasSize(2);
    }

    @Test
    @DisplayName("clear should forget tracked aggregates and reload on next get")
    void testClear() {
      Order stale = new Order("order-9");
      Order fresh = new Order("order-9");
      when(repository.get(Order.class, "order-9"))
          .thenReturn(Optional.of(stale))
          .thenReturn(Optional.of(fresh));
      context.get(Order.class, "order-9");

      context.clear();

      assertThat(context.getTrackedAggregateRoots()).isEmpty();
      assertThat(context.get(Order.class, "order-9")).isSameAs(fresh);
    }
  }

  @Nested
  @DisplayName("onCommandExecuted")
  class CompletionTests {

    @Test
    @DisplayName("should complete the context once and ignore later calls")
    void testOnCommandExecuted_OnlyOnce() throws Exception {
      boolean first = context.onCommandExecuted(CommandResult.success("order-1"));
      boolean second = context.onCommandExecuted(CommandResult.failed(null, "X", "late"));

      assertThat(first).isTrue();
      assertThat(second).isFalse();
      assertThat(context.isCompleted()).isTrue();
      assertThat(completion.get().status()).isEqualTo(CommandStatus.SUCCESS);
      assertThat(completion.get().aggregateRootId()).isEqualTo("order-1");
    }

    @Test
    @DisplayName("should reject a null result")
    void testOnCommandExecuted_Null() {
      assertThatThrownBy(() -> context.onCommandExecuted(null))
          .isInstanceOf(NullPointerException.class);
      assertThat(context.isCompleted()).isFalse();
    }
  }

  @Test
  @DisplayName("should expose command, routing items and result topic")
  void testAccessors() {
    assertThat(context.getCommand().id()).isEqualTo("cmd-1");
    assertThat(context.getQueueMessage().queueOffset()).isZero();
    assertThat(context.getResultTopic()).isEqualTo("command-results");
    assertThat(context.getStartedAt()).isEqualTo(STARTED_AT);
    assertThat(context.getItems()).containsEntry("DomainEventHandledMessageTopic", "handled");
    assertThatThrownBy(() -> context.getItems().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
