package io.automock.core.error;

/**
 * Abstract parent for failures while transforming or serializing
 * expectations. The input is left unmodified whenever one is thrown.
 */
public abstract class ExpectationTransformException extends ExpectationException {

    private static final long serialVersionUID = 1L;

    protected ExpectationTransformException(String message, String context) {
        super(message, context, Kind.TRANSFORM);
    }

    protected ExpectationTransformException(String message, Throwable cause, String context) {
        super(message, cause, context, Kind.TRANSFORM);
    }
}
