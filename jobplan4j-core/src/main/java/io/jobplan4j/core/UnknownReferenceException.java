package io.jobplan4j.core;

/**
 * A dependency names a job that does not exist, or a job names a machine that does not exist.
 */
public class UnknownReferenceException extends IllegalArgumentException {

    private final String reference;

    public UnknownReferenceException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    /**
     * The id that could not be resolved.
     */
    public String reference() {
        return reference;
    }
}
