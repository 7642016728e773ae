package org.eds.engine;

/**
 * The external factorisation solver. Implementations fit W and H (and, for re-evaluatable
 * dictionaries, may call {@code refresh} between iterations) and return the fitted triple.
 */
@FunctionalInterface
public interface DecompositionEngine {

    FittedDecomposition decompose(DecompositionRequest request);
}
