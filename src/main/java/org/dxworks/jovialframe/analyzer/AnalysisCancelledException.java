package org.dxworks.jovialframe.analyzer;

/**
 * Thrown at a stage boundary when a newer edit has superseded the running pass.
 */
public class AnalysisCancelledException extends RuntimeException {

    private final long generation;

    public AnalysisCancelledException(long generation, String stage) {
        super("analysis of generation " + generation + " cancelled before " + stage, null, false, false);
        this.generation = generation;
    }

    public long getGeneration() {
        return generation;
    }
}
