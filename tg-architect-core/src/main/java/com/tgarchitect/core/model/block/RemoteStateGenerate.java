package com.tgarchitect.core.model.block;

/**
 * {@code generate} attribute of a remote_state block.
 *
 * @param path generated backend file
 * @param ifExists behaviour when the file exists
 */
public record RemoteStateGenerate(String path, String ifExists) {

    public static final String DEFAULT_PATH = "backend.tf";

    public RemoteStateGenerate {
        path = path == null ? DEFAULT_PATH : path;
        ifExists = ifExists == null ? GenerateBlock.DEFAULT_IF_EXISTS : ifExists;
    }
}
