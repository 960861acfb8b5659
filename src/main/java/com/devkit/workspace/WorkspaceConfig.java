package com.devkit.workspace;

import com.devkit.config.DevkitProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class WorkspaceConfig {

    @Bean
    public WorkspaceProvider workspaceProvider(DevkitProperties properties) {
        var ws = properties.getWorkspace();
        return new GitWorktreeProvider(Path.of(ws.getRepository()), Path.of(ws.getRoot()), ws.getBranchPrefix(),
                ws.getRemote(), ws.isPushOnIntegrate(), ws.getAuthorName(), ws.getAuthorEmail());
    }

    @Bean
    public WorkspaceManager workspaceManager(WorkspaceProvider workspaceProvider, DevkitProperties properties) {
        return new WorkspaceManager(workspaceProvider, properties.getWorkspace().getBaseRevision());
    }
}
