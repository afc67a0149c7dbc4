package com.eainde.dialog.tools.workspace;

import com.eainde.dialog.tools.AgentTool;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class ListDirectoryTool implements AgentTool {

    public static final String NAME = "list_directory";

    private static final ToolSpecification SPECIFICATION = ToolSpecification.builder()
            .name(NAME)
            .description("Lists files and directories of the project workspace. Directories end with '/'.")
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("path", "Directory relative to the workspace root, '.' for the root")
                    .build())
            .build();

    private final Workspace workspace;

    public ListDirectoryTool(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public ToolSpecification specification() {
        return SPECIFICATION;
    }

    @Override
    public Object execute(JsonNode arguments) throws Exception {
        Path directory = workspace.resolve(Workspace.optionalText(arguments, "path"));
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(workspace.relativize(directory), null, "not a directory");
        }
        try (Stream<Path> entries = Files.list(directory)) {
            String listing = entries
                    .sorted()
                    .map(p -> workspace.relativize(p) + (Files.isDirectory(p) ? "/" : ""))
                    .collect(Collectors.joining("\n"));
            return listing.isEmpty() ? "(empty)" : listing;
        }
    }
}
