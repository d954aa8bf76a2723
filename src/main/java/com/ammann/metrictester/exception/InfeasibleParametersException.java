/* (C)2026 */
package com.ammann.metrictester.exception;

/**
 * Raised before any sampling work when quadrat placement parameters would cover too much of
 * the arena for rejection sampling to terminate in reasonable time.
 */
public class InfeasibleParametersException extends ValidationException {

    public InfeasibleParametersException(String message) {
        super(message);
    }

    /**
     * Creates the exception for a placement whose expected covered fraction exceeds the limit.
     */
    public static InfeasibleParametersException coverage(double coveredFraction, double limit) {
        return new InfeasibleParametersException(
                String.format(
                        "Quadrat and/or arena size parameters unsuitable: quadrats would cover %.3f"
                                + " of the arena, at most %.2f allowed. Sample less of total arena",
                        coveredFraction, limit));
    }
}
