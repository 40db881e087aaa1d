package com.project.chc.io;

import com.project.chc.crypto.ErrorLogger;

import java.security.SecureRandom;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Secrets kept in JVM memory only; lost when the process stops. Demo and test use.
 */
public class InMemorySecretStore implements SecretStore {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Map<String, byte[]> ownerSecrets = new ConcurrentHashMap<>();
    private final Map<String, Map<String, byte[]>> wrappedSeeds = new ConcurrentHashMap<>();
    private final Map<String, byte[]> systemKeys = new ConcurrentHashMap<>();

    @Override
    public byte[] getOrCreateOwnerSecret(String owner) {
        return ownerSecrets.computeIfAbsent(owner, o -> {
            ErrorLogger.logInfo("InMemorySecretStore.getOrCreateOwnerSecret", "Generated new secret for owner " + o);
            return randomKey();
        }).clone();
    }

    @Override
    public Optional<byte[]> findOwnerSecret(String owner) {
        return Optional.ofNullable(ownerSecrets.get(owner)).map(byte[]::clone);
    }

    @Override
    public void putWrappedSeed(String fileId, String principal, byte[] wrappedSeed) {
        wrappedSeeds.computeIfAbsent(fileId, f -> new ConcurrentHashMap<>()).put(principal, wrappedSeed.clone());
    }

    @Override
    public Optional<byte[]> findWrappedSeed(String fileId, String principal) {
        return Optional.ofNullable(wrappedSeeds.getOrDefault(fileId, Map.of()).get(principal)).map(byte[]::clone);
    }

    @Override
    public int deleteWrappedSeeds(String fileId) {
        Map<String, byte[]> removed = wrappedSeeds.remove(fileId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public byte[] getOrCreateSystemKey(String purpose) {
        return systemKeys.computeIfAbsent(purpose, p -> randomKey()).clone();
    }

    static byte[] randomKey() {
        byte[] key = new byte[SECRET_LENGTH];
        RANDOM.nextBytes(key);
        return key;
    }
}
