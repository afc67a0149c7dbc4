package com.eainde.dialog.tools.workspace;

import com.eainde.dialog.tools.AgentTool;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class WriteFileTool implements AgentTool {

    public static final String NAME = "write_file";

    private static final ToolSpecification SPECIFICATION = ToolSpecification.builder()
            .name(NAME)
            .description("Writes text content to a file in the project workspace, replacing any previous content.")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("path", "File to write, relative to the workspace root")
                    .addStringProperty("content", "Full text content of the file")
                    .required("path", "content")
                    .build())
            .build();

    private final Workspace workspace;

    public WriteFileTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolSpecification specification() {
        return SPECIFICATION;
    }

    @Override
    public Object execute(JsonNode arguments) throws Exception {
        Path file = workspace.resolve(Workspace.requiredText(arguments, "path"));
        String content = Workspace.requiredText(arguments, "content");

        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return "Wrote " + content.length() + " characters to " + workspace.relativize(file);
    }
}
