package com.acme.users.application;

import com.acme.commanding.command.CommandContext;
import com.acme.commanding.command.CommandHandlerRegistry;
import com.acme.commanding.command.CommandTypeRegistry;
import com.acme.commanding.worker.config.CommandModule;
import com.acme.users.application.command.CreateUserCommand;
import com.acme.users.application.command.RenameUserCommand;
import com.acme.users.domain.User;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Command handlers for the user bounded context
 */
@Singleton
@Slf4j
public class UserCommandModule implements CommandModule {

    @Override
    public void register(CommandTypeRegistry types, CommandHandlerRegistry handlers) {
        types.register(CreateUserCommand.TYPE, CreateUserCommand.class)
            .register(RenameUserCommand.TYPE, RenameUserCommand.class);
        handlers.registerHandler(CreateUserCommand.class, this::handleCreateUser);
        handlers.registerHandler(RenameUserCommand.class, this::handleRenameUser);
    }

    void handleCreateUser(CommandContext context, CreateUserCommand cmd) {
        log.info("Creating user {} with name {}", cmd.userId(), cmd.name());
        context.add(new User(cmd.userId(), cmd.name()));
    }

    void handleRenameUser(CommandContext context, RenameUserCommand cmd) {
        User user = context.get(User.class, cmd.userId());
        log.info("Renaming user {} from {} to {}", cmd.userId(), user.getName(), cmd.name());
        user.rename(cmd.name());
    }
}
