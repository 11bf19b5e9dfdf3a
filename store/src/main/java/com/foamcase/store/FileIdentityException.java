package com.foamcase.store;

/**
 * A file handle was asked for something its identity does not allow: rolling back to a snapshot it does not
 * own, saving without a parsed tree, or reaching outside the directory it is confined to.
 */
public final class FileIdentityException extends Exception {
    public FileIdentityException(String message) {
        super(message);
    }
}
