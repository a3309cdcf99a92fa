package com.dcruver.provenance.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the SQLite data source.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${provenance.database-path}") String databasePath) throws IOException {
        Path dbPath = Paths.get(databasePath.replace("${user.home}", System.getProperty("user.home")));
        return sqliteDataSource(dbPath);
    }

    /**
     * SQLite data source with foreign keys enforced and a busy timeout, set on every
     * connection through the URL since SQLite pragmas are per connection.
     */
    public static DataSource sqliteDataSource(Path dbPath) throws IOException {
        // Ensure parent directory exists
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath() + "?foreign_keys=true&busy_timeout=5000");

        return dataSource;
    }
}
