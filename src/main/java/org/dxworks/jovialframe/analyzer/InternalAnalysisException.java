package org.dxworks.jovialframe.analyzer;

/**
 * An analysis pass broke one of its own invariants. The pass is dropped and the previous snapshot stays current.
 */
public class InternalAnalysisException extends RuntimeException {

    public InternalAnalysisException(String message) {
        super(message);
    }

    public InternalAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
