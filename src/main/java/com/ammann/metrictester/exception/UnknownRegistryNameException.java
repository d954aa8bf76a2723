/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Raised when a caller requests a metric or null model that is not part of the catalogue.
 *
 * <p>Mapped to HTTP 400 by {@link GlobalExceptionHandler}. The offending name is kept so
 * callers can report it without parsing the message.
 */
public class UnknownRegistryNameException extends ValidationException {

    private final String registry;
    private final String name;

    public UnknownRegistryNameException(String registry, String name) {
        super(String.format("Unknown %s '%s'", registry, name));
        this.registry = registry;
        this.name = name;
    }

    public static UnknownRegistryNameException metric(String name) {
        return new UnknownRegistryNameException("metric", name);
    }

    public static UnknownRegistryNameException nullModel(String name) {
        return new UnknownRegistryNameException("null model", name);
    }

    public String getRegistry() {
        return registry;
    }

    public String getName() {
        return name;
    }
}
