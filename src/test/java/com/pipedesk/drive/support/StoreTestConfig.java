package com.pipedesk.drive.support;

import com.pipedesk.drive.service.store.InMemoryFolderStoreClient;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class StoreTestConfig {

    @Bean
    @Primary
    public FlakyFolderStoreClient flakyFolderStoreClient(InMemoryFolderStoreClient inMemoryFolderStoreClient) {
        return new FlakyFolderStoreClient(inMemoryFolderStoreClient);
    }
}
