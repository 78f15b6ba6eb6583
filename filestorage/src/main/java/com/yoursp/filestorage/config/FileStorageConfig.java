package com.yoursp.filestorage.config;

import com.yoursp.filestorage.service.storage.FileStorage;
import com.yoursp.filestorage.service.storage.StorageAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link FileStorage} facade over the adapter selected by the active profile.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FileStorageProperties.class)
@ComponentScan(basePackageClasses = FileStorage.class)
public class FileStorageConfig {

    @Bean
    public FileStorage fileStorage(StorageAdapter storageAdapter) {
        log.info("FileStorage backed by {}", storageAdapter.getClass().getSimpleName());
        return new FileStorage(storageAdapter);
    }
}
