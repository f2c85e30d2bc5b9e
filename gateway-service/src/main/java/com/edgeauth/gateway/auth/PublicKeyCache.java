package com.edgeauth.gateway.auth;

import com.edgeauth.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily fetched copy of the issuer's public key, valid for a fixed TTL.
 *
 * <p>Reads take no lock: the key and its expiry are published together as one
 * immutable snapshot, so {@link #peek()} is safe on event-loop threads even
 * while a refill is running. A cold or expired cache is refilled under
 * {@code refillLock} so concurrent misses trigger a single fetch. An expired
 * key is never handed out, even when the issuer is unreachable.
 */
@Slf4j
@Component
public class PublicKeyCache {

    private final PublicKeyFetcher fetcher;
    private final Clock clock;
    private final Duration ttl;
    private final ReentrantLock refillLock = new ReentrantLock();

    // written only while holding refillLock
    private volatile CachedPublicKey cached;

    @Autowired
    public PublicKeyCache(PublicKeyFetcher fetcher, Clock clock, GatewayProperties properties) {
        this(fetcher, clock, properties.getIssuer().getKeyTtl());
    }

    public PublicKeyCache(PublicKeyFetcher fetcher, Clock clock, Duration ttl) {
        this.fetcher = fetcher;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Returns the cached key if still fresh, otherwise fetches a new one.
     *
     * @throws KeyUnavailableException if a fetch was needed and failed; the
     *                                 previous cache state is kept
     */
    public PublicKey getKey() {
        PublicKey fresh = peek();
        if (fresh != null) {
            return fresh;
        }

        refillLock.lock();
        try {
            CachedPublicKey current = cached;
            if (current != null && current.isFreshAt(clock.instant())) {
                return current.key();
            }

            PublicKey key = fetcher.fetch();
            CachedPublicKey refreshed = new CachedPublicKey(key, clock.instant().plus(ttl));
            cached = refreshed;
            log.info("Public key fetched and cached, expires_at={}", refreshed.expiresAt());
            return key;
        } finally {
            refillLock.unlock();
        }
    }

    /**
     * @return the cached key if fresh, {@code null} otherwise; never fetches and never blocks
     */
    public PublicKey peek() {
        CachedPublicKey current = cached;
        if (current != null && current.isFreshAt(clock.instant())) {
            return current.key();
        }
        return null;
    }

    public void invalidate() {
        refillLock.lock();
        try {
            cached = null;
            log.info("Public key cache invalidated");
        } finally {
            refillLock.unlock();
        }
    }

    record CachedPublicKey(PublicKey key, Instant expiresAt) {

        boolean isFreshAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
