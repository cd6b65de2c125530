package com.gacha.economy.account;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stores the whole account table as one JSON object keyed by user id.
 * Every save writes a temp file next to the target and moves it into place, so a crash
 * leaves either the previous or the new table on disk.
 */
public class JsonFileAccountRepository implements AccountRepository {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileAccountRepository.class);

    private final Path path;
    private final ObjectMapper mapper;

    public JsonFileAccountRepository(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Map<Long, Account> loadAll() {
        if (!Files.exists(path)) {
            logger.info("no account state found path={}", path);
            return new LinkedHashMap<>();
        }
        try {
            Map<Long, Account> accounts = mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<Long, Account>>() {});
            logger.info("account state loaded path={} accounts={}", path, accounts.size());
            return accounts;
        } catch (IOException e) {
            throw new StorageException("Failed to read account state from " + path, e);
        }
    }

    @Override
    public void saveAll(Collection<Account> accounts) {
        // Each account is copied under its own monitor so a concurrent mutation cannot tear it
        Map<Long, JsonNode> table = new TreeMap<>();
        for (Account account : accounts) {
            synchronized (account) {
                table.put(account.getUserId(), mapper.valueToTree(account));
            }
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), table);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("atomic move unsupported, falling back to replace path={}", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write account state to " + path, e);
        }
    }
}
