package com.acme.commanding.worker.lifecycle;

import static org.mockito.Mockito.*;

import com.acme.commanding.config.ConsumerConfig;
import com.acme.commanding.consumer.CommandConsumer;
import io.micronaut.context.event.StartupEvent;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CommandConsumerLifecycle Tests")
class CommandConsumerLifecycleTest {

  @Mock private CommandConsumer consumer;

  @Test
  @DisplayName("startup should subscribe every configured topic before starting")
  void testStartup() {
    ConsumerConfig config = new ConsumerConfig();
    config.setTopics(List.of("user-commands", "order-commands"));
    CommandConsumerLifecycle lifecycle = new CommandConsumerLifecycle(consumer, config);

    lifecycle.onApplicationEvent(mock(StartupEvent.class));

    InOrder inOrder = inOrder(consumer);
    inOrder.verify(consumer).subscribe("user-commands");
    inOrder.verify(consumer).subscribe("order-commands");
    inOrder.verify(consumer).start();
  }

  @Test
  @DisplayName("stop should shut the consumer down")
  void testStop() {
    CommandConsumerLifecycle lifecycle = new CommandConsumerLifecycle(consumer, new ConsumerConfig());

    lifecycle.stop();

    verify(consumer).shutdown();
  }
}
