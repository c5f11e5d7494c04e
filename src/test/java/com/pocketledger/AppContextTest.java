package com.pocketledger;

import com.pocketledger.cli.MenuShell;
import com.pocketledger.core.store.Repository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "app.security.scrypt-cost=10")
class AppContextTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void dataDir(DynamicPropertyRegistry registry) {
        registry.add("app.data.dir", () -> dataDir.toString());
    }

    @Autowired
    MenuShell shell;

    @Autowired
    Repository repository;

    @Test
    void wiresTheMenuOnAFileDatabase() {
        assertThat(shell).isNotNull();
        assertThat(repository.findUserByUsername("nobody")).isEmpty();
        assertThat(Files.exists(dataDir.resolve("finance.db"))).isTrue();
    }
}
