package com.eainde.dialog.tools.workspace;

import com.eainde.dialog.tools.AgentTool;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.nio.file.Files;
import java.nio.file.Path;

public class CreateDirectoryTool implements AgentTool {

    public static final String NAME = "create_directory";

    private static final ToolSpecification SPECIFICATION = ToolSpecification.builder()
            .name(NAME)
            .description("Creates a directory (and any missing parents) inside the project workspace.")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("path", "Directory to create, relative to the workspace root")
                    .required("path")
                    .build())
            .build();

    private final Workspace workspace;

    public CreateDirectoryTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolSpecification specification() {
        return SPECIFICATION;
    }

    @Override
    public Object execute(JsonNode arguments) throws Exception {
        Path directory = workspace.resolve(Workspace.requiredText(arguments, "path"));
        Files.createDirectories(directory);
        return "Created directory " + workspace.relativize(directory);
    }
}
