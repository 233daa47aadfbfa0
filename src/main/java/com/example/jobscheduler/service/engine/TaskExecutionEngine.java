package com.example.jobscheduler.service.engine;

/**
 * Capability that runs a natural-language prompt with a set of callable tools.
 * <p>
 * Implementations should:
 * - Stop after {@link EngineRequest#getMaxSteps()} internal steps
 * - Report every tool call in the returned step trace
 * - Signal failure with {@link com.example.jobscheduler.exception.EngineInvocationException}
 */
public interface TaskExecutionEngine {

    /**
     * Run one prompt to completion
     *
     * @param request prompt, instruction, tools and step ceiling
     * @return final text and the step trace
     */
    EngineResult invoke(EngineRequest request);
}
