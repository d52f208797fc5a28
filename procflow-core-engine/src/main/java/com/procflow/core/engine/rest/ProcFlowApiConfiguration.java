package com.procflow.core.engine.rest;

import com.procflow.core.engine.IProcFlowFacade;
import com.procflow.core.engine.ProcFlowFacade;
import com.procflow.core.engine.recovery.ProcFlowRunRecoveryWorker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the run, approval and definition REST controllers.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * @SpringBootApplication
 * @Import(ProcFlowApiConfiguration.class)
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * }</pre>
 *
 * <p>Controllers share the process-wide {@link ProcFlowFacade#getInstance()}. The recovery
 * worker starts with the context and re-walks runs abandoned by a previous process.</p>
 */
@Configuration
public class ProcFlowApiConfiguration {

    @Bean
    public IProcFlowFacade procFlowFacade() {
        return ProcFlowFacade.getInstance();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ProcFlowRunRecoveryWorker procFlowRunRecoveryWorker() {
        ProcFlowFacade facade = (ProcFlowFacade) ProcFlowFacade.getInstance();
        return new ProcFlowRunRecoveryWorker(facade.getExecutionStore(), facade.getRunWalker(),
                facade.getLockService(), facade.getConfig());
    }

    @Bean
    public ProcessRunController processRunController(IProcFlowFacade procFlowFacade) {
        return new ProcessRunController(procFlowFacade);
    }

    @Bean
    public ApprovalInboxController approvalInboxController(IProcFlowFacade procFlowFacade) {
        return new ApprovalInboxController(procFlowFacade);
    }

    @Bean
    public ProcessDefinitionController processDefinitionController(IProcFlowFacade procFlowFacade) {
        return new ProcessDefinitionController(procFlowFacade);
    }
}
