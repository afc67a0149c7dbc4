package com.eainde.dialog.config;

import com.eainde.dialog.nodes.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration of the dialog router, bound from {@code application.yml} under {@code router}.
 */
@Data
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    private Ollama ollama = new Ollama();
    private Models models = new Models();
    private Retry retry = new Retry();
    private Timeouts timeouts = new Timeouts();
    private WorkspaceSettings workspace = new WorkspaceSettings();
    private Checkpoint checkpoint = new Checkpoint();
    private Session session = new Session();
    private Console console = new Console();

    @Data
    public static class Ollama {
        private String baseUrl = "http://localhost:11434";
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Models {
        private ModelSettings primary = new ModelSettings();
        private ModelSettings architect = new ModelSettings();
        private ModelSettings coder = new ModelSettings();
        private ModelSettings tester = new ModelSettings();
    }

    @Data
    public static class ModelSettings {
        private String name = "llama3.1:8b";
        private double temperature = 0.1;
        /** -2 lets the model fill its context window. */
        private int numPredict = -2;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 5;
        private RetryPolicy.OnExhausted onExhausted = RetryPolicy.OnExhausted.APOLOGIZE;
        private String apology = RetryPolicy.DEFAULT_APOLOGY;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, onExhausted, apology);
        }
    }

    @Data
    public static class Timeouts {
        private Duration model = Duration.ofSeconds(120);
        private Duration tool = Duration.ofSeconds(30);
    }

    @Data
    public static class WorkspaceSettings {
        private String root = "./workspace";
    }

    @Data
    public static class Checkpoint {
        private Store store = Store.MEMORY;
        private boolean initializeSchema = true;
    }

    public enum Store {
        MEMORY, JDBC
    }

    @Data
    public static class Session {
        private String defaultId = "0";
    }

    @Data
    public static class Console {
        private boolean enabled = false;
    }
}
