package com.phillippitts.dualscribe.exception;

/**
 * Thrown when the local recognition model cannot be found at the configured path.
 * This is a fatal error; the local recognizer cannot open any session without it.
 */
public class ModelNotFoundException extends RecognitionException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Recognition model not found at path: " + modelPath, null);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Recognition model not found at path: " + modelPath, null, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
