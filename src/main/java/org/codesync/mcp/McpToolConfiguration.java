package org.codesync.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册：把 {@link WorkspaceMcpTools} 的 {@code @Tool} 方法暴露为 MCP 工具。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> workspaceToolCallbacks(WorkspaceMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
