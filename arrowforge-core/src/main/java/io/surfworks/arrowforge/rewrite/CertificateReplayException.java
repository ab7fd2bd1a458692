package io.surfworks.arrowforge.rewrite;

/**
 * Exception thrown when a certificate does not replay against its start path.
 */
public class CertificateReplayException extends RuntimeException {

    private final int stepIndex;

    public CertificateReplayException(String message, int stepIndex) {
        super(stepIndex >= 0 ? String.format("%s (step %d)", message, stepIndex) : message);
        this.stepIndex = stepIndex;
    }

    /**
     * Returns the index of the failing step, or -1 if the failure is not tied to a step.
     */
    public int getStepIndex() {
        return stepIndex;
    }
}
