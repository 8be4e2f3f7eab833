package br.edu.ifba.ragflow.state;

/**
 * Base class for errors raised by {@link AsyncState}.
 *
 * <p>State errors are recoverable: the calling stage decides whether a missing
 * stage or field is fatal for its own work.</p>
 */
public class StateException extends RuntimeException {

    public StateException(String message) {
        super(message);
    }
}
