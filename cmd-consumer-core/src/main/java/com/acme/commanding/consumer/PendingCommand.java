package com.acme.commanding.consumer;

import com.acme.commanding.command.CommandResult;
import com.acme.commanding.spi.MessageReceipt;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * In-flight entry for one command: the receipt to acknowledge and the one-shot completion that
 * the unit of work resolves.
 */
public record PendingCommand(
    String commandId,
    MessageReceipt receipt,
    Instant startedAt,
    CompletableFuture<CommandResult> completion) {}
