package com.pocketledger;

import com.pocketledger.core.error.StorageException;
import com.pocketledger.core.store.Repository;
import com.pocketledger.core.store.SqliteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Clock;

@SpringBootApplication
public class SpringConfig {
    private static final Logger log = LoggerFactory.getLogger(SpringConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * The single datastore handle, shared by every service through {@link Repository}.
     */
    @Bean(destroyMethod = "close")
    public Connection sqliteConnection(@Value("${app.data.dir}") String dataDir,
                                       @Value("${app.db.file:finance.db}") String dbFile) {
        try {
            Path dir = Path.of(dataDir);
            Files.createDirectories(dir);
            Path db = dir.resolve(dbFile);
            log.info("Opening ledger database {}", db.toAbsolutePath());
            return DriverManager.getConnection("jdbc:sqlite:" + db);
        } catch (IOException | SQLException e) {
            throw new StorageException("Cannot open database in " + dataDir + ": " + e.getMessage(), e);
        }
    }

    @Bean
    public Repository repository(Connection sqliteConnection) {
        return new SqliteRepository(sqliteConnection);
    }
}
