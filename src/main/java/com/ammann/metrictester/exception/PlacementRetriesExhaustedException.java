/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Raised when a quadrat could not be placed without overlap within the configured number of
 * attempts, even though the density precondition was satisfied.
 *
 * <p>Mapped to HTTP 409 (Conflict) by {@link GlobalExceptionHandler}.
 */
public class PlacementRetriesExhaustedException extends ApiException {

    private final int quadrat;
    private final int attempts;

    public PlacementRetriesExhaustedException(int quadrat, int attempts) {
        super(String.format(
                "Could not place quadrat %d without overlap after %d attempts", quadrat, attempts));
        this.quadrat = quadrat;
        this.attempts = attempts;
    }

    public int getQuadrat() {
        return quadrat;
    }

    public int getAttempts() {
        return attempts;
    }
}
