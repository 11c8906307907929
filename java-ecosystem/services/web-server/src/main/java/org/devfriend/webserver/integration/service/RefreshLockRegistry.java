package org.devfriend.webserver.integration.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One in-process mutex per integration, so at most one token refresh per integration runs at a time.
 * Only valid for a single-instance deployment.
 */
@Component
public class RefreshLockRegistry {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(Long integrationId) {
        return locks.computeIfAbsent(integrationId, id -> new ReentrantLock());
    }

    public void release(Long integrationId) {
        locks.remove(integrationId);
    }

    int size() {
        return locks.size();
    }
}
