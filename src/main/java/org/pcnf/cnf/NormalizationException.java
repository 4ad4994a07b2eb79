package org.pcnf.cnf;

/**
 * La distribuzione OR su AND non ha raggiunto un punto fisso entro il limite
 * di iterazioni. Indica un difetto nelle regole di riscrittura, non un input errato.
 */
public class NormalizationException extends IllegalStateException {

    public NormalizationException(String message) {
        super(message);
    }
}
