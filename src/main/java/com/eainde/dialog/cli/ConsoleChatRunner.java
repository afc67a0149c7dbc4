package com.eainde.dialog.cli;

import com.eainde.dialog.config.RouterProperties;
import com.eainde.dialog.exception.DialogRouterException;
import com.eainde.dialog.workflow.DialogSessionEngine;
import com.eainde.dialog.workflow.SessionReply;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Interactive console conversation on the default session.
 */
@Log4j2
@Component
@ConditionalOnProperty(prefix = "router.console", name = "enabled", havingValue = "true")
public class ConsoleChatRunner implements CommandLineRunner {

    static final String FAREWELL = "Assistant: Goodbye!";
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit");

    private final DialogSessionEngine engine;
    private final String sessionId;

    public ConsoleChatRunner(DialogSessionEngine engine, RouterProperties properties) {
        this.engine = engine;
        this.sessionId = properties.getSession().getDefaultId();
    }

    @Override
    public void run(String... args) throws IOException {
        converse(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
    }

    void converse(Reader input, PrintStream out) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        out.println("Session " + sessionId + ". Type 'exit' to leave.");
        while (true) {
            out.print("User: ");
            out.flush();
            String line = reader.readLine();
            if (line == null || EXIT_COMMANDS.contains(line.trim().toLowerCase())) {
                return;
            }
            if (line.isBlank()) {
                continue;
            }

            SessionReply reply;
            try {
                reply = engine.chat(sessionId, line);
            } catch (DialogRouterException e) {
                log.error("Turn failed", e);
                out.println("Error: " + e.getMessage());
                continue;
            }
            String text = reply.text().trim();
            out.println(text.startsWith("Assistant:") ? text : "Assistant: " + text);

            if (FAREWELL.equals(text)) {
                return;
            }
        }
    }
}
