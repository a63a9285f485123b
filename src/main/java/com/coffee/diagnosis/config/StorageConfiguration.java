package com.coffee.diagnosis.config;

import com.coffee.diagnosis.service.store.FileSystemImageStore;
import com.coffee.diagnosis.service.store.ImageStore;
import com.coffee.diagnosis.service.store.JdbcPredictionRepository;
import com.coffee.diagnosis.service.store.PredictionRepository;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public ImageStore imageStore(DiagnosisProperties properties) {
        Path directory = Path.of(properties.storage().uploadDirectory()).toAbsolutePath();
        log.info("Storing uploaded images in {}", directory);
        return new FileSystemImageStore(directory);
    }

    @Bean
    public PredictionRepository predictionRepository(JdbcTemplate jdbcTemplate,
            @Value("${spring.datasource.url:}") String datasourceUrl) {
        createDatabaseDirectory(datasourceUrl);
        return new JdbcPredictionRepository(jdbcTemplate);
    }

    /** SQLite creates the database file but not its parent directory. */
    static void createDatabaseDirectory(String datasourceUrl) {
        if (datasourceUrl == null || !datasourceUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String location = datasourceUrl.substring(SQLITE_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(location).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create database directory " + parent, ex);
        }
    }
}
