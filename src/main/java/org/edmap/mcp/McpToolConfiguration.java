package org.edmap.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 从容器中收集 {@link ToolCallback}，把 {@link DensityMcpTools} 的密度图查询能力通过 MCP 协议暴露给调用方。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> densityToolCallbacks(DensityMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
