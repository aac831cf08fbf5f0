package com.williamcallahan.docarchive.cli;

import java.util.Arrays;
import java.util.Optional;

/**
 * Management commands accepted as the first program argument.
 */
public enum ManagementCommand {
    DOCUMENT_ARCHIVER("document_archiver"),
    DOCUMENT_RENAMER("document_renamer"),
    DOCUMENT_SANITY_CHECKER("document_sanity_checker"),
    DECRYPT_DOCUMENTS("decrypt_documents");

    private final String commandName;

    ManagementCommand(String commandName) {
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }

    public static Optional<ManagementCommand> fromName(String name) {
        return Arrays.stream(values())
                .filter(command -> command.commandName.equals(name))
                .findFirst();
    }
}
