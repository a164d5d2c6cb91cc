package com.acme.users.application.command;

import com.acme.commanding.command.Command;

/** Command to register a new user */
public record CreateUserCommand(String id, String userId, String name) implements Command {
    public static final String TYPE = "CreateUser";
}
