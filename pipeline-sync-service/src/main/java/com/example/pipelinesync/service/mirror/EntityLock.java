package com.example.pipelinesync.service.mirror;

import com.example.pipelinesync.config.MirrorSyncProperties;
import com.example.pipelinesync.exception.SyncInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Per-entity ShedLock lock, so one entity never has two overlapping sync runs,
 * across threads or replicas.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EntityLock {

    private static final String PREFIX = "mirror-";

    private final LockingTaskExecutor lockingTaskExecutor;
    private final MirrorSyncProperties properties;
    private final Clock clock;

    /**
     * @throws SyncInProgressException when another run holds the lock
     */
    public <T> T runLocked(String entityName, Supplier<T> task) {
        LockConfiguration lock = new LockConfiguration(clock.instant(), PREFIX + entityName,
                properties.getLockAtMostFor(), Duration.ZERO);

        LockingTaskExecutor.TaskWithResult<T> lockedTask = task::get;
        LockingTaskExecutor.TaskResult<T> result;
        try {
            result = lockingTaskExecutor.executeWithLock(lockedTask, lock);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new IllegalStateException("Locked task failed for entity=" + entityName, e);
        }

        if (!result.wasExecuted()) {
            log.warn("Skipping sync, lock held elsewhere: entity={}", entityName);
            throw new SyncInProgressException(entityName);
        }
        return result.getResult();
    }
}
