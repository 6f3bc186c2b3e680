package com.mouse.keeper.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.exception.AccountConflictException;
import com.mouse.keeper.exception.AccountNotFoundException;
import com.mouse.keeper.exception.AccountStorageException;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.AccountUpdate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accounts backed by a JSON array on disk.
 * <p>
 * Readers get an immutable snapshot; writers are serialized, persist first and publish
 * the new snapshot only once the file has been replaced.
 */
@Slf4j
@Repository
public class AccountRepository {

    private static final TypeReference<List<Account>> ACCOUNT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path file;
    private final AtomicReference<List<Account>> snapshot = new AtomicReference<>(List.of());
    private final Object writeLock = new Object();

    public AccountRepository(ObjectMapper objectMapper, KeeperProperties properties) {
        this.objectMapper = objectMapper;
        this.file = Paths.get(properties.getPool().getAccountsFile());
    }

    @PostConstruct
    public void init() {
        if (!Files.exists(file)) {
            log.warn("Accounts file {} not found, starting with no accounts", file.toAbsolutePath());
            return;
        }
        reload();
    }

    public List<Account> findAll() {
        return snapshot.get();
    }

    public Optional<Account> findByName(String name) {
        return snapshot.get().stream()
                .filter(a -> a.getName().equals(name))
                .findFirst();
    }

    public Account add(Account account) {
        synchronized (writeLock) {
            List<Account> current = new ArrayList<>(snapshot.get());
            Account toAdd = copyOf(account);
            if (toAdd.getName() == null || toAdd.getName().isBlank()) {
                toAdd.setName("Account_" + (current.size() + 1));
            }
            String name = toAdd.getName();
            if (current.stream().anyMatch(a -> a.getName().equals(name))) {
                throw new AccountConflictException("Account already exists: " + name);
            }
            current.add(toAdd);
            persist(current);
            log.info("Added account {} (key {})", name, toAdd.keyPreview());
            return toAdd;
        }
    }

    /**
     * Applies the non-null fields of {@code changes} to the named account. The name itself
     * is not changed.
     */
    public Account update(String name, AccountUpdate changes) {
        synchronized (writeLock) {
            List<Account> current = new ArrayList<>(snapshot.get());
            int index = indexOf(current, name);
            Account.AccountBuilder builder = current.get(index).toBuilder();
            if (changes.getProvider() != null) {
                builder.provider(changes.getProvider());
            }
            if (changes.getApiUser() != null) {
                builder.apiUser(changes.getApiUser());
            }
            if (changes.getApiKey() != null) {
                builder.apiKey(changes.getApiKey());
            }
            if (changes.getCookies() != null) {
                builder.cookies(new LinkedHashMap<>(changes.getCookies()));
            }
            if (changes.getEnabled() != null) {
                builder.enabled(changes.getEnabled());
            }
            Account updated = builder.build();
            current.set(index, updated);
            persist(current);
            log.info("Updated account {}", name);
            return updated;
        }
    }

    public void remove(String name) {
        synchronized (writeLock) {
            List<Account> current = new ArrayList<>(snapshot.get());
            current.remove(indexOf(current, name));
            persist(current);
            log.info("Removed account {}", name);
        }
    }

    public Account toggle(String name) {
        synchronized (writeLock) {
            List<Account> current = new ArrayList<>(snapshot.get());
            int index = indexOf(current, name);
            Account toggled = current.get(index).toBuilder()
                    .enabled(!current.get(index).isEnabled())
                    .build();
            current.set(index, toggled);
            persist(current);
            log.info("Account {} is now {}", name, toggled.isEnabled() ? "enabled" : "disabled");
            return toggled;
        }
    }

    /**
     * Re-reads the file. On a parse error or a duplicate account name the previous
     * snapshot stays in place.
     */
    public List<Account> reload() {
        synchronized (writeLock) {
            List<Account> loaded;
            try {
                loaded = Files.exists(file) ? objectMapper.readValue(file.toFile(), ACCOUNT_LIST) : List.of();
            } catch (IOException e) {
                throw new AccountStorageException("Failed to read accounts from " + file, e);
            }

            List<Account> normalized = new ArrayList<>();
            for (int i = 0; i < loaded.size(); i++) {
                Account account = copyOf(loaded.get(i));
                if (account.getName() == null || account.getName().isBlank()) {
                    account.setName("Account_" + (i + 1));
                }
                normalized.add(account);
            }
            Set<String> names = new HashSet<>();
            for (Account account : normalized) {
                if (!names.add(account.getName())) {
                    throw new AccountStorageException("Duplicate account name '" + account.getName() + "' in " + file);
                }
            }
            snapshot.set(List.copyOf(normalized));

            long usable = normalized.stream().filter(a -> a.isEnabled() && a.hasApiKey()).count();
            log.info("Loaded {} accounts from {} ({} enabled with an API key)", normalized.size(), file, usable);
            return snapshot.get();
        }
    }

    public Path getFile() {
        return file;
    }

    private void persist(List<Account> accounts) {
        Path temp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), accounts);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(temp, e);
            throw new AccountStorageException("Failed to write accounts to " + file, e);
        }
        snapshot.set(List.copyOf(accounts));
    }

    private static void discard(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static int indexOf(List<Account> accounts, String name) {
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).getName().equals(name)) {
                return i;
            }
        }
        throw new AccountNotFoundException(name);
    }

    private static Account copyOf(Account account) {
        return account.toBuilder()
                .cookies(account.getCookies() != null ? new LinkedHashMap<>(account.getCookies()) : new LinkedHashMap<>())
                .build();
    }
}
