package com.phillippitts.octvol.exception;

/**
 * Thrown when a volume model violates one of its structural invariants.
 * Always a defect in the code that built the model, never recoverable by the caller.
 */
public class VolumeInvariantException extends OctVolException {

    private final String rule;

    public VolumeInvariantException(String rule, String detail) {
        super("Volume invariant violated [" + rule + "]: " + detail);
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
