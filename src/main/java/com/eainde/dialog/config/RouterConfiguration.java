package com.eainde.dialog.config;

import com.eainde.dialog.checkpoint.InMemoryCheckpointSaver;
import com.eainde.dialog.checkpoint.JdbcCheckpointSaver;
import com.eainde.dialog.model.AgentPrompts;
import com.eainde.dialog.model.LangChain4jAgentModel;
import com.eainde.dialog.model.ModelCallLoggingListener;
import com.eainde.dialog.nodes.AgentNode;
import com.eainde.dialog.nodes.RetryPolicy;
import com.eainde.dialog.nodes.ToolExecutorNode;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.thread.ExternalCallGuard;
import com.eainde.dialog.thread.MdcAwareExecutor;
import com.eainde.dialog.tools.AgentTool;
import com.eainde.dialog.tools.HandoffTools;
import com.eainde.dialog.tools.ToolRegistry;
import com.eainde.dialog.tools.workspace.CreateDirectoryTool;
import com.eainde.dialog.tools.workspace.ListDirectoryTool;
import com.eainde.dialog.tools.workspace.ReadFileTool;
import com.eainde.dialog.tools.workspace.Workspace;
import com.eainde.dialog.tools.workspace.WriteFileTool;
import com.eainde.dialog.workflow.CoordinatorAgent;
import com.eainde.dialog.workflow.DialogSessionEngine;
import com.eainde.dialog.workflow.DialogWorkflowGraph;
import com.eainde.dialog.workflow.NodeExecutionListener;
import com.eainde.dialog.workflow.NodeNames;
import com.eainde.dialog.workflow.SpecialistAgent;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the dialog graph: one Ollama model per agent, the agents' tool sets, the checkpoint store
 * and the session engine.
 */
@Log4j2
@Configuration
@RequiredArgsConstructor
public class RouterConfiguration {

    private final RouterProperties properties;

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor externalCallExecutor() {
        return new MdcAwareExecutor("external-call");
    }

    @Bean
    public ExternalCallGuard externalCallGuard(MdcAwareExecutor externalCallExecutor) {
        return new ExternalCallGuard(externalCallExecutor);
    }

    @Bean
    public Workspace workspace() throws IOException {
        Workspace workspace = new Workspace(Path.of(properties.getWorkspace().getRoot()));
        log.info("File tools are sandboxed to {}", workspace.root());
        return workspace;
    }

    @Bean
    public ChatModelListener modelCallLoggingListener() {
        return new ModelCallLoggingListener();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return properties.getRetry().toPolicy();
    }

    @Bean
    public CoordinatorAgent coordinatorAgent(Workspace workspace,
                                             ObjectMapper objectMapper,
                                             ExternalCallGuard callGuard,
                                             ChatModelListener modelCallLoggingListener,
                                             RetryPolicy retryPolicy) {
        ToolRegistry tools = new ToolRegistry(List.of(new ListDirectoryTool(workspace)), objectMapper);

        List<ToolSpecification> specifications = new ArrayList<>(tools.specifications());
        specifications.addAll(HandoffTools.allHandoffs());

        LangChain4jAgentModel model = new LangChain4jAgentModel(
                NodeNames.PRIMARY_ASSISTANT,
                ollamaModel(properties.getModels().getPrimary(), modelCallLoggingListener),
                AgentPrompts.PRIMARY,
                specifications,
                callGuard,
                properties.getTimeouts().getModel());

        return new CoordinatorAgent(
                new AgentNode(NodeNames.PRIMARY_ASSISTANT, model, retryPolicy),
                new ToolExecutorNode(NodeNames.PRIMARY_ASSISTANT_TOOLS, tools, callGuard,
                        properties.getTimeouts().getTool()));
    }

    @Bean
    public DialogWorkflowGraph dialogWorkflowGraph(CoordinatorAgent coordinatorAgent,
                                                   Workspace workspace,
                                                   ObjectMapper objectMapper,
                                                   ExternalCallGuard callGuard,
                                                   ChatModelListener modelCallLoggingListener,
                                                   RetryPolicy retryPolicy) {
        List<SpecialistAgent> agents = new ArrayList<>();
        for (AgentContext context : AgentContext.values()) {
            ToolRegistry tools = new ToolRegistry(specialistTools(context, workspace), objectMapper);

            List<ToolSpecification> specifications = new ArrayList<>(tools.specifications());
            specifications.add(HandoffTools.completeOrEscalate());

            LangChain4jAgentModel model = new LangChain4jAgentModel(
                    context.nodeName(),
                    ollamaModel(modelSettings(context), modelCallLoggingListener),
                    AgentPrompts.forAgent(context),
                    specifications,
                    callGuard,
                    properties.getTimeouts().getModel());

            agents.add(new SpecialistAgent(
                    context,
                    new AgentNode(context.nodeName(), model, retryPolicy),
                    new ToolExecutorNode(context.toolsNodeName(), tools, callGuard,
                            properties.getTimeouts().getTool())));
        }
        return new DialogWorkflowGraph(coordinatorAgent, agents);
    }

    @Bean
    public BaseCheckpointSaver checkpointSaver(ObjectProvider<JdbcTemplate> jdbcTemplate, ObjectMapper objectMapper) {
        RouterProperties.Checkpoint settings = properties.getCheckpoint();
        if (settings.getStore() == RouterProperties.Store.JDBC) {
            JdbcCheckpointSaver saver = new JdbcCheckpointSaver(jdbcTemplate.getObject(), objectMapper);
            if (settings.isInitializeSchema()) {
                saver.initializeSchema();
            }
            log.info("Checkpoints are stored in the database");
            return saver;
        }
        log.info("Checkpoints are kept in memory");
        return new InMemoryCheckpointSaver();
    }

    @Bean
    public CompiledGraph<SessionState> dialogGraph(DialogWorkflowGraph dialogWorkflowGraph,
                                                   BaseCheckpointSaver checkpointSaver) {
        return dialogWorkflowGraph.build(checkpointSaver, NodeExecutionListener.NONE);
    }

    @Bean
    public DialogSessionEngine dialogSessionEngine(CompiledGraph<SessionState> dialogGraph,
                                                   BaseCheckpointSaver checkpointSaver) {
        return new DialogSessionEngine(dialogGraph, checkpointSaver, properties.getSession().getDefaultId());
    }

    private List<AgentTool> specialistTools(AgentContext context, Workspace workspace) {
        switch (context) {
            case ARCHITECT:
                return List.of(new ListDirectoryTool(workspace),
                        new CreateDirectoryTool(workspace),
                        new WriteFileTool(workspace));
            case CODER:
            case TESTER:
                return List.of(new ListDirectoryTool(workspace),
                        new ReadFileTool(workspace),
                        new WriteFileTool(workspace));
            default:
                throw new IllegalStateException("Unexpected agent: " + context);
        }
    }

    private RouterProperties.ModelSettings modelSettings(AgentContext context) {
        RouterProperties.Models models = properties.getModels();
        switch (context) {
            case ARCHITECT:
                return models.getArchitect();
            case CODER:
                return models.getCoder();
            case TESTER:
                return models.getTester();
            default:
                throw new IllegalStateException("Unexpected agent: " + context);
        }
    }

    private ChatModel ollamaModel(RouterProperties.ModelSettings settings, ChatModelListener listener) {
        log.info("Initializing Ollama model {} at {}", settings.getName(), properties.getOllama().getBaseUrl());
        return OllamaChatModel.builder()
                .baseUrl(properties.getOllama().getBaseUrl())
                .modelName(settings.getName())
                .temperature(settings.getTemperature())
                .numPredict(settings.getNumPredict())
                .timeout(properties.getOllama().getTimeout())
                .listeners(List.of(listener))
                .build();
    }
}
