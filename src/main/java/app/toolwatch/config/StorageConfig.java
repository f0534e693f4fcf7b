package app.toolwatch.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;

/**
 * SQLite-Datei als DataSource. WAL erlaubt Lesen während geschrieben wird, der Busy-Timeout
 * lässt konkurrierende Schreiber (auch andere Collector-Prozesse) warten statt abzubrechen.
 * Das Schema legt Flyway an ({@code db/migration}).
 */
@Slf4j
@Configuration
public class StorageConfig {

    static final int BUSY_TIMEOUT_MS = 5000;

    @Bean
    public DataSource dataSource(CollectorProperties properties) throws IOException {
        Path dbFile = Path.of(properties.dbPath()).toAbsolutePath();
        Files.createDirectories(dbFile.getParent());

        HikariConfig config = new HikariConfig();
        config.setPoolName("toolwatch-sqlite");
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl(jdbcUrl(dbFile));
        config.setMaximumPoolSize(4);

        log.info("Using SQLite database {}", dbFile);
        return new HikariDataSource(config);
    }

    static String jdbcUrl(Path dbFile) {
        return "jdbc:sqlite:" + dbFile + "?journal_mode=WAL&busy_timeout=" + BUSY_TIMEOUT_MS;
    }
}
