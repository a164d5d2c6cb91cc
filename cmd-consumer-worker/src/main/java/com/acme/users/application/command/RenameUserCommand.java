package com.acme.users.application.command;

import com.acme.commanding.command.ProcessCommand;

/** Command to change a user's display name, issued as a step of a process */
public record RenameUserCommand(String id, String processId, String userId, String name)
    implements ProcessCommand {
    public static final String TYPE = "RenameUser";
}
