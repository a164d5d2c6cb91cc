package com.acme.commanding.domain;

import static org.assertj.core.api.Assertions.*;

import com.acme.commanding.testsupport.Customer;
import com.acme.commanding.testsupport.Order;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryAggregateRepository Tests")
class InMemoryAggregateRepositoryTest {

  private final InMemoryAggregateRepository repository = new InMemoryAggregateRepository();

  @Test
  @DisplayName("should return saved aggregate by id and type")
  void testSaveAndGet() {
    repository.save(new Order("order-1"));

    Order loaded = repository.get(Order.class, "order-1").orElseThrow();
    assertThat(loaded.uniqueId()).isEqualTo("order-1");
    assertThat(loaded.getStatus()).isEqualTo("PLACED");
    assertThat(repository.get(Order.class, "order-2")).isEmpty();
  }

  @Test
  @DisplayName("should not return an aggregate of another type")
  void testGet_WrongType() {
    repository.save(new Customer("id-1"));

    assertThat(repository.get(Order.class, "id-1")).isEmpty();
    assertThat(repository.get(Customer.class, "id-1")).contains(new Customer("id-1"));
    assertThat(repository.get(AggregateRoot.class, "id-1")).contains(new Customer("id-1"));
  }

  @Test
  @DisplayName("saving the same id twice should replace the stored aggregate")
  void testSave_Replace() {
    Order second = new Order("order-1");
    second.cancel();

    repository.save(new Order("order-1"));
    repository.save(second);

    assertThat(repository.get(Order.class, "order-1").orElseThrow().getStatus())
        .isEqualTo("CANCELLED");
    assertThat(repository.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("changes to a loaded aggregate should not be visible until saved")
  void testGet_ReturnsCopy() {
    Order saved = new Order("order-1");
    repository.save(saved);

    Order loaded = repository.get(Order.class, "order-1").orElseThrow();
    loaded.cancel();
    saved.cancel();

    assertThat(loaded).isNotSameAs(repository.get(Order.class, "order-1").orElseThrow());
    assertThat(repository.get(Order.class, "order-1").orElseThrow().getStatus())
        .isEqualTo("PLACED");

    repository.save(loaded);

    assertThat(repository.get(Order.class, "order-1").orElseThrow().getStatus())
        .isEqualTo("CANCELLED");
  }
}
