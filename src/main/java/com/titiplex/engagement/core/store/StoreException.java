package com.titiplex.engagement.core.store;

/**
 * Erreur de la couche SQLite. Les services l'interceptent et la convertissent en échec.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
