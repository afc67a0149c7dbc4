package com.eainde.dialog.tools.workspace;

import com.eainde.dialog.tools.AgentTool;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ReadFileTool implements AgentTool {

    public static final String NAME = "read_file";

    private static final ToolSpecification SPECIFICATION = ToolSpecification.builder()
            .name(NAME)
            .description("Reads a text file from the project workspace.")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("path", "File to read, relative to the workspace root")
                    .required("path")
                    .build())
            .build();

    private final Workspace workspace;

    public ReadFileTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolSpecification specification() {
        return SPECIFICATION;
    }

    @Override
    public Object execute(JsonNode arguments) throws Exception {
        Path file = workspace.resolve(Workspace.requiredText(arguments, "path"));
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
