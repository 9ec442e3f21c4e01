package de.conciso.plantdiag.service;

/**
 * Der Graph-Snapshot ist strukturell unbrauchbar (keine Liste von Records).
 * Ein teilweise geladener Graph wird nie zurückgegeben.
 */
public class GraphLoadException extends RuntimeException {

    public GraphLoadException(String message) {
        super(message);
    }

    public GraphLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
