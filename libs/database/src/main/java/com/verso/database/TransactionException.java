package com.verso.database;

import com.verso.versioner.VersionerException;

/** A transaction wrapping a change could not be opened, committed or rolled back. */
public class TransactionException extends VersionerException {

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
