package com.ryuqq.jobqueue.adapter.inmemory.vault;

import com.ryuqq.jobqueue.core.spi.SecretResolver;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이름으로 secret을 조회하는 in-memory vault.
 *
 * <p>저장/조회 시 모두 복사본을 사용합니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class InMemorySecretVault implements SecretResolver {

    private final ConcurrentHashMap<String, byte[]> secrets = new ConcurrentHashMap<>();

    /**
     * secret 저장 (같은 이름이면 교체).
     *
     * @param name secret 이름
     * @param secret secret bytes
     * @return this
     */
    public InMemorySecretVault put(String name, byte[] secret) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (secret == null) {
            throw new IllegalArgumentException("secret cannot be null");
        }
        secrets.put(name, secret.clone());
        return this;
    }

    public InMemorySecretVault put(String name, String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret cannot be null");
        }
        return put(name, secret.getBytes(StandardCharsets.UTF_8));
    }

    public void remove(String name) {
        secrets.remove(name);
    }

    @Override
    public Optional<byte[]> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        byte[] secret = secrets.get(name);
        return secret == null ? Optional.empty() : Optional.of(secret.clone());
    }
}
