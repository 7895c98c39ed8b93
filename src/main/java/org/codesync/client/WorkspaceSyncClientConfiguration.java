package org.codesync.client;

import org.codesync.sync.WorkspaceSyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class WorkspaceSyncClientConfiguration {

    @Bean(destroyMethod = "close")
    public WorkspaceSyncClientFactory workspaceSyncClientFactory(
            RestClient.Builder restClientBuilder,
            WorkspaceSyncProperties properties,
            Clock clock
    ) {
        return new WorkspaceSyncClientFactory(restClientBuilder, properties.getClient().getUploadParallelism(), clock);
    }
}
