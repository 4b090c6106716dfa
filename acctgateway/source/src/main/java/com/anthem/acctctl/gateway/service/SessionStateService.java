package com.anthem.acctctl.gateway.service;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.context.AccountContext;
import com.anthem.acctctl.core.session.SavedSession;
import com.anthem.acctctl.core.session.SessionCodec;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Initializes the account context on first use and persists its state to
 * {@code acctctl.session.file}, so a restarted gateway reuses the discovered
 * identity, accounts and still-valid credentials.
 *
 * Account operations run one at a time through {@link #exclusive(Function)}:
 * they share the registered accounts and their control baselines.
 */
@Slf4j
@Service
public class SessionStateService {

    private final AccountContext context;
    private final AcctCtlProperties properties;
    private final ReentrantLock lock = new ReentrantLock();

    public SessionStateService(AccountContext context, AcctCtlProperties properties) {
        this.context = context;
        this.properties = properties;
    }

    /**
     * Returns the initialized context, restoring the persisted session if one
     * is available.
     */
    public AccountContext context() {
        lock.lock();
        try {
            if (!context.isInitialized()) {
                Optional<SavedSession> saved = sessionFile().flatMap(SessionCodec::read);
                if (saved.isPresent()) {
                    context.restore(saved.get());
                } else {
                    context.init();
                }
            }
            return context;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code op} against the initialized context while holding the
     * session lock. Concurrent callers wait for the running operation.
     */
    public <T> T exclusive(Function<AccountContext, T> op) {
        lock.lock();
        try {
            return op.apply(context());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the current context state. Failures are logged and do not affect
     * the operation that triggered the save.
     */
    public void save() {
        Optional<Path> file = sessionFile();
        if (file.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            if (!context.isInitialized()) {
                return;
            }
            SessionCodec.write(file.get(), context.save());
            log.debug("Session saved: file={}", file.get());
        } catch (RuntimeException e) {
            log.warn("Failed to save session: file={}, error={}", file.get(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        save();
    }

    private Optional<Path> sessionFile() {
        String f = properties.getSession().getFile();
        return f == null || f.isBlank() ? Optional.empty() : Optional.of(Path.of(f));
    }
}
