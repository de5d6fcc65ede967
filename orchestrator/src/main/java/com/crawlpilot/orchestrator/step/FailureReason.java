package com.crawlpilot.orchestrator.step;

/** Why a step attempt produced a failed {@link StepResult}. */
public enum FailureReason {
    /** preExecute() returned false; the backend was never called. */
    PRECONDITION_FAILED,
    /** The backend answered with success=false. */
    BACKEND_FAILURE,
    /** The step or the backend call threw. */
    EXCEPTION
}
