package com.example.emailscheduler.client;

import com.example.emailscheduler.client.ClientModels.MailSession;
import com.example.emailscheduler.config.EmailSchedulerProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;

/**
 * Per-account pool of mail sessions with explicit lease and return.
 * <p>
 * At most {@code max-per-account} sessions are leased for one account at a
 * time; further callers wait until a lease is returned. Returned sessions are
 * reused until they have been idle longer than {@code max-idle-minutes}.
 * A lease whose session failed should be invalidated so the session is closed
 * instead of returned.
 */
@Slf4j
@Component
public class MailSessionPool {

    private final MailFetchClient mailFetchClient;
    private final int maxPerAccount;
    private final Duration maxIdle;
    private final Clock clock;

    private final Map<String, AccountSessions> accounts = new ConcurrentHashMap<>();

    @Autowired
    public MailSessionPool(MailFetchClient mailFetchClient, EmailSchedulerProperties properties) {
        this(mailFetchClient, properties.getMailSessionPool().getMaxPerAccount(),
                Duration.ofMinutes(properties.getMailSessionPool().getMaxIdleMinutes()), Clock.systemUTC());
    }

    MailSessionPool(MailFetchClient mailFetchClient, int maxPerAccount, Duration maxIdle, Clock clock) {
        this.mailFetchClient = mailFetchClient;
        this.maxPerAccount = maxPerAccount;
        this.maxIdle = maxIdle;
        this.clock = clock;
    }

    /**
     * Lease a session for the account, blocking while all of its sessions are leased.
     *
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public Lease lease(String accountId) {
        var sessions = acquirePermit(accountId);
        try {
            var session = takeIdle(sessions);
            if (session == null) {
                session = mailFetchClient.openSession(accountId);
                log.debug("Opened new mail session {} for account {}", session.getSessionId(), accountId);
            }
            return new Lease(accountId, session, sessions);
        } catch (RuntimeException e) {
            sessions.permits.release();
            throw e;
        }
    }

    /**
     * Close sessions that have been idle longer than the configured limit and
     * drop accounts left with no leased or idle sessions.
     */
    @Scheduled(fixedDelayString = "${email-scheduler.mail-session-pool.eviction-interval-ms:60000}")
    public void evictIdle() {
        var cutoff = clock.instant().minus(maxIdle);
        var evicted = 0;
        for (var sessions : accounts.values()) {
            for (var idle : new ArrayList<>(sessions.idle)) {
                if (idle.returnedAt.isBefore(cutoff) && sessions.idle.remove(idle)) {
                    mailFetchClient.closeSession(idle.session);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("Closed {} idle mail sessions", evicted);
        }
        retireUnusedAccounts();
    }

    @PreDestroy
    public void shutdown() {
        for (var sessions : accounts.values()) {
            IdleSession idle;
            while ((idle = sessions.idle.pollFirst()) != null) {
                mailFetchClient.closeSession(idle.session);
            }
        }
    }

    int idleCount(String accountId) {
        var sessions = accounts.get(accountId);
        return sessions == null ? 0 : sessions.idle.size();
    }

    int accountCount() {
        return accounts.size();
    }

    private AccountSessions acquirePermit(String accountId) {
        while (true) {
            var sessions = accounts.computeIfAbsent(accountId, id -> new AccountSessions(maxPerAccount));
            try {
                sessions.permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for a mail session of account " + accountId, e);
            }
            synchronized (sessions) {
                if (!sessions.retired) {
                    return sessions;
                }
            }
            // Entry was dropped while we waited; retry against a fresh one
            sessions.permits.release();
        }
    }

    private void retireUnusedAccounts() {
        for (var entry : accounts.entrySet()) {
            var sessions = entry.getValue();
            synchronized (sessions) {
                if (sessions.idle.isEmpty()
                        && sessions.permits.availablePermits() == maxPerAccount
                        && !sessions.permits.hasQueuedThreads()) {
                    sessions.retired = true;
                    accounts.remove(entry.getKey(), sessions);
                    log.debug("Dropped session pool entry for inactive account {}", entry.getKey());
                }
            }
        }
    }

    private MailSession takeIdle(AccountSessions sessions) {
        var cutoff = clock.instant().minus(maxIdle);
        IdleSession idle;
        while ((idle = sessions.idle.pollLast()) != null) {
            if (!idle.returnedAt.isBefore(cutoff)) {
                return idle.session;
            }
            mailFetchClient.closeSession(idle.session);
        }
        return null;
    }

    private void giveBack(AccountSessions sessions, MailSession session, boolean broken) {
        try {
            if (broken) {
                mailFetchClient.closeSession(session);
            } else {
                sessions.idle.addLast(new IdleSession(session, clock.instant()));
            }
        } finally {
            sessions.permits.release();
        }
    }

    private static final class AccountSessions {
        private final Semaphore permits;
        private final Deque<IdleSession> idle = new ConcurrentLinkedDeque<>();
        private boolean retired;

        private AccountSessions(int maxPerAccount) {
            this.permits = new Semaphore(maxPerAccount, true);
        }
    }

    private static final class IdleSession {
        private final MailSession session;
        private final Instant returnedAt;

        private IdleSession(MailSession session, Instant returnedAt) {
            this.session = session;
            this.returnedAt = returnedAt;
        }
    }

    /**
     * A session on loan from the pool. Closing the lease returns the session.
     */
    public final class Lease implements AutoCloseable {

        private final String accountId;
        private final MailSession session;
        private final AccountSessions owner;
        private boolean broken;
        private boolean returned;

        private Lease(String accountId, MailSession session, AccountSessions owner) {
            this.accountId = accountId;
            this.session = session;
            this.owner = owner;
        }

        public MailSession getSession() {
            return session;
        }

        public String getAccountId() {
            return accountId;
        }

        /**
         * Close the session on return instead of pooling it.
         */
        public void invalidate() {
            this.broken = true;
        }

        @Override
        public void close() {
            if (returned) {
                return;
            }
            returned = true;
            giveBack(owner, session, broken);
        }
    }
}
