package com.astroslide.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Progress of one preset execution: IDLE, VALIDATING, EXECUTING stage i of N, then DONE
 * or FAILED. The cancel flag may be raised from another thread; the engine checks it
 * between stages.
 */
public class PipelineRun {

    private volatile ExecutionState state = ExecutionState.IDLE;
    private volatile int stageIndex = -1;
    private volatile int stageCount;
    private volatile EnhancementException failure;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ExecutionState getState() { return state; }
    public int getStageIndex() { return stageIndex; }
    public int getStageCount() { return stageCount; }
    public EnhancementException getFailure() { return failure; }

    public void cancel() { cancelled.set(true); }
    public boolean isCancelled() { return cancelled.get(); }

    public void validating() {
        if (state != ExecutionState.IDLE) {
            throw new IllegalStateException("Run already started: " + state);
        }
        state = ExecutionState.VALIDATING;
    }

    public void executing(int index, int count) {
        stageIndex = index;
        stageCount = count;
        state = ExecutionState.EXECUTING;
    }

    public void done() {
        state = ExecutionState.DONE;
    }

    public EnhancementException fail(EnhancementException e) {
        failure = e;
        state = ExecutionState.FAILED;
        return e;
    }

    @Override
    public String toString() {
        if (state == ExecutionState.EXECUTING) return state + "(" + (stageIndex + 1) + "/" + stageCount + ")";
        return state.toString();
    }
}
