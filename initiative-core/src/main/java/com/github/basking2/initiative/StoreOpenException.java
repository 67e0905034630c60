package com.github.basking2.initiative;

/**
 * Opening a store failed. The store is left at the last schema version that was committed and no handle
 * to it is handed out.
 */
public class StoreOpenException extends Exception {
    public StoreOpenException(final String message) {
        super(message);
    }

    public StoreOpenException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
