package com.acme.commanding.command;

import static org.assertj.core.api.Assertions.*;

import com.acme.commanding.core.Jsons;
import com.acme.commanding.testsupport.PlaceOrderCommand;
import com.acme.commanding.testsupport.ShipOrderCommand;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CommandExecutedMessage Tests")
class CommandExecutedMessageTest {

  @Test
  @DisplayName("should carry success fields and no process id for plain commands")
  void testOf_Success() {
    CommandExecutedMessage message =
        CommandExecutedMessage.of(
            new PlaceOrderCommand("cmd-1", "order-1"), CommandResult.success("order-1"));

    assertThat(message.commandId()).isEqualTo("cmd-1");
    assertThat(message.aggregateRootId()).isEqualTo("order-1");
    assertThat(message.processId()).isNull();
    assertThat(message.commandStatus()).isEqualTo(CommandStatus.SUCCESS);
    assertThat(message.exceptionTypeName()).isNull();
    assertThat(message.errorMessage()).isNull();
  }

  @Test
  @DisplayName("should take process id from process commands")
  void testOf_ProcessCommand() {
    CommandExecutedMessage message =
        CommandExecutedMessage.of(
            new ShipOrderCommand("cmd-2", "proc-9", "order-1"),
            CommandResult.failed("order-1", new IllegalArgumentException("bad address")));

    assertThat(message.processId()).isEqualTo("proc-9");
    assertThat(message.commandStatus()).isEqualTo(CommandStatus.FAILED);
    assertThat(message.exceptionTypeName()).isEqualTo("IllegalArgumentException");
    assertThat(message.errorMessage()).isEqualTo("bad address");
  }

  @Test
  @DisplayName("toJson should write the status by name")
  void testToJson() throws Exception {
    String json =
        CommandExecutedMessage.of(
                new PlaceOrderCommand("cmd-1", "order-1"), CommandResult.timedOut("too slow"))
            .toJson();

    JsonNode node = new ObjectMapper().readTree(json);
    assertThat(node.get("commandId").asText()).isEqualTo("cmd-1");
    assertThat(node.get("commandStatus").asText()).isEqualTo("TIMED_OUT");
    assertThat(node.get("errorMessage").asText()).isEqualTo("too slow");
    assertThat(Jsons.fromJson(json, CommandExecutedMessage.class).commandStatus())
        .isEqualTo(CommandStatus.TIMED_OUT);
  }
}
