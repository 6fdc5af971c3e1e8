package eu.virtualparadox.docindex.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Filesystem locations of the engine. An unset {@code index} keeps the Lucene index in memory.
 */
@Configuration
@ConfigurationProperties(prefix = "docindex")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }

    /**
     * Time source for {@code indexedAt} stamps and staleness checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
