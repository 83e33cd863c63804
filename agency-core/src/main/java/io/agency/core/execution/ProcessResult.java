package io.agency.core.execution;

/// Answer to a single-turn process request.
///
/// @param response the final or partial answer, never null
/// @param stepsExecuted reasoning iterations used
/// @param completed `false` when the answer was cut off by the thinking-step bound
public record ProcessResult(String response, int stepsExecuted, boolean completed) {

    public ProcessResult {
        response = response != null ? response : "";
    }
}
