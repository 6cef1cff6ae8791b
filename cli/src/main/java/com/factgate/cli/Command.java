package com.factgate.cli;

import java.util.Optional;

/**
 * Commands understood by {@link FactGateCli}.
 */
public enum Command {

    /** Validate a work product, optionally with its body text. */
    VALIDATE_WORK_PRODUCT("validate-work-product"),

    /** Validate body text, optionally grounded against a work product. */
    VALIDATE_TEXT("validate-text");

    private final String commandName;

    Command(String commandName) {
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }

    public static Optional<Command> fromName(String name) {
        for (Command command : values()) {
            if (command.commandName.equals(name)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
