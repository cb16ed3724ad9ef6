package com.example.agentflow.config;

import com.example.agentflow.agent.AgentInvocationService;
import com.example.agentflow.orchestration.LevelParallelScheduler;
import com.example.agentflow.orchestration.RunningWorkflowRegistry;
import com.example.agentflow.orchestration.SequentialScheduler;
import com.example.agentflow.orchestration.StepExecutor;
import com.example.agentflow.orchestration.StepProgressRecorder;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the orchestration engine: step executor, both schedulers, the running-workflow registry and
 * the two thread pools they run on.
 */
@Configuration
public class OrchestrationConfiguration {

    /**
     * Level-parallel workers, one task per step of a level.
     */
    @Bean(name = "workflowStepExecutor")
    public ThreadPoolTaskExecutor workflowStepExecutor(WorkflowExecutionProperties properties) {
        return pool("wf-step-", properties.getParallelism());
    }

    /**
     * Blocking agent calls, awaited by the step executor with a deadline.
     */
    @Bean(name = "agentCallExecutor")
    public ThreadPoolTaskExecutor agentCallExecutor(WorkflowExecutionProperties properties) {
        return pool("agent-call-", properties.getParallelism() * 2);
    }

    @Bean
    public StepExecutor stepExecutor(AgentInvocationService invocationService,
                                     StepProgressRecorder recorder,
                                     @Qualifier("agentCallExecutor") ThreadPoolTaskExecutor agentCallExecutor,
                                     WorkflowExecutionProperties properties) {
        return new StepExecutor(invocationService, recorder, agentCallExecutor.getThreadPoolExecutor(),
                properties.getStepTimeout());
    }

    @Bean
    public SequentialScheduler sequentialScheduler(StepExecutor stepExecutor) {
        return new SequentialScheduler(stepExecutor);
    }

    @Bean
    public LevelParallelScheduler levelParallelScheduler(StepExecutor stepExecutor,
                                                         @Qualifier("workflowStepExecutor") ThreadPoolTaskExecutor workers) {
        return new LevelParallelScheduler(stepExecutor, workers);
    }

    @Bean
    public RunningWorkflowRegistry runningWorkflowRegistry() {
        return new RunningWorkflowRegistry();
    }

    private static ThreadPoolTaskExecutor pool(String threadNamePrefix, int size) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
