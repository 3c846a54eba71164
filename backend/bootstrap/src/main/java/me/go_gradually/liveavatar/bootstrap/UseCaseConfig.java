package me.go_gradually.liveavatar.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.liveavatar.application.bridge.policy.BridgePolicy;
import me.go_gradually.liveavatar.application.bridge.port.UpstreamGateway;
import me.go_gradually.liveavatar.application.bridge.usecase.FunctionCallOrchestrator;
import me.go_gradually.liveavatar.application.bridge.usecase.SessionRegistry;
import me.go_gradually.liveavatar.application.bridge.usecase.SessionSetup;
import me.go_gradually.liveavatar.application.shared.port.MetricsPort;
import me.go_gradually.liveavatar.application.tool.port.ToolFunction;
import me.go_gradually.liveavatar.application.tool.usecase.ToolRegistry;
import me.go_gradually.liveavatar.infrastructure.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class UseCaseConfig {
    // 세션마다 수신 루프와 도구 호출이 스레드를 점유한다.
    @Bean(destroyMethod = "shutdown")
    public ExecutorService bridgeExecutorService(AppProperties properties) {
        int workerThreads = properties.getSession().getWorkerThreads();
        if (workerThreads > 0) {
            return Executors.newFixedThreadPool(workerThreads);
        }
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolFunction> toolFunctions) {
        return new ToolRegistry(toolFunctions);
    }

    @Bean
    public SessionSetup sessionSetup(BridgePolicy bridgePolicy) {
        return new SessionSetup(bridgePolicy);
    }

    @Bean
    public FunctionCallOrchestrator functionCallOrchestrator(ToolRegistry toolRegistry,
                                                             ObjectMapper objectMapper,
                                                             BridgePolicy bridgePolicy,
                                                             MetricsPort metricsPort) {
        return new FunctionCallOrchestrator(toolRegistry, objectMapper, bridgePolicy, metricsPort);
    }

    @Bean(destroyMethod = "stopAll")
    public SessionRegistry sessionRegistry(UpstreamGateway upstreamGateway,
                                           SessionSetup sessionSetup,
                                           FunctionCallOrchestrator functionCallOrchestrator,
                                           ExecutorService bridgeExecutorService,
                                           BridgePolicy bridgePolicy,
                                           MetricsPort metricsPort) {
        return new SessionRegistry(
                upstreamGateway,
                sessionSetup,
                functionCallOrchestrator,
                bridgeExecutorService,
                bridgePolicy,
                metricsPort
        );
    }
}
