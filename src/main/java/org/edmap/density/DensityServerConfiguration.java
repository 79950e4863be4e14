package org.edmap.density;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 密度图 MCP 服务的 Bean 装配。
 * <p>
 * 把配置 {@link DensityServerProperties} 注入到路径解析器、密度图加载器与缓存中。
 */
@Configuration(proxyBeanMethods = false)
public class DensityServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(DensityServerProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public DensityMapLoader densityMapLoader(DensityServerProperties properties, SecurePathResolver pathResolver) {
        return new DensityMapLoader(properties, pathResolver);
    }

    @Bean
    public DensityMapCache densityMapCache(DensityServerProperties properties) {
        return new DensityMapCache(properties);
    }
}
