package com.di.recalibrator.agent.lock;

import com.di.recalibrator.config.RecalibratorProperties;
import com.di.recalibrator.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-horizon advisory locks that hold across threads and processes: an in-process claim
 * plus an OS lock on {@code <state-dir>/locks/<name>.lock}.
 * <p>
 * Two locks exist per horizon. The run lock covers a whole recalibration run and is only ever
 * tried, never waited for. The config lock covers the short sections that write the live
 * configuration or the monitoring window, and is waited for with a bounded timeout.
 */
@Slf4j
@Component
public class HorizonLockManager {

    private final Path lockDir;
    private final Duration acquireTimeout;
    private final Duration retryInterval;
    private final Set<String> held = ConcurrentHashMap.newKeySet();

    @Autowired
    public HorizonLockManager(RecalibratorProperties props) {
        this(Paths.get(props.getStorage().getStateDir()).resolve("locks"),
                props.getLocking().getAcquireTimeout(),
                props.getLocking().getRetryInterval());
    }

    public HorizonLockManager(Path lockDir, Duration acquireTimeout, Duration retryInterval) {
        this.lockDir = lockDir;
        this.acquireTimeout = acquireTimeout;
        this.retryInterval = retryInterval;
    }

    public static String runLockName(String horizon) {
        return "run-" + horizon;
    }

    public static String configLockName(String horizon) {
        return "config-" + horizon;
    }

    /** Tries the run lock once; empty when another run holds it. */
    public Optional<HorizonLock> tryRunLock(String horizon) {
        return tryLock(runLockName(horizon));
    }

    /** Waits up to the configured timeout for the config lock. */
    public HorizonLock configLock(String horizon) {
        return lock(configLockName(horizon), acquireTimeout, horizon);
    }

    public Optional<HorizonLock> tryLock(String name) {
        if (!held.add(name)) {
            log.debug("[LOCK] {} already held in this process", name);
            return Optional.empty();
        }
        FileChannel channel = null;
        try {
            Files.createDirectories(lockDir);
            channel = FileChannel.open(lockDir.resolve(name + ".lock"),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                channel.close();
                held.remove(name);
                log.debug("[LOCK] {} held by another process", name);
                return Optional.empty();
            }
            log.debug("[LOCK] acquired {}", name);
            return Optional.of(new HorizonLock(name, channel, fileLock, held));
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel, name);
            held.remove(name);
            return Optional.empty();
        } catch (IOException e) {
            closeQuietly(channel, name);
            held.remove(name);
            throw new InfrastructureException(InfrastructureException.Stage.LOCK, name,
                    "cannot open lock file in " + lockDir, e);
        }
    }

    /**
     * Retries {@link #tryLock(String)} every retry interval until it succeeds or the timeout
     * passes.
     *
     * @throws InfrastructureException when the lock is not acquired in time
     */
    public HorizonLock lock(String name, Duration timeout, String horizon) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<HorizonLock> lock = tryLock(name);
            if (lock.isPresent()) {
                return lock.get();
            }
            if (System.nanoTime() >= deadline) {
                throw new InfrastructureException(InfrastructureException.Stage.LOCK, horizon,
                        "timed out after " + timeout + " waiting for " + name);
            }
            try {
                Thread.sleep(retryInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InfrastructureException(InfrastructureException.Stage.LOCK, horizon,
                        "interrupted waiting for " + name, e);
            }
        }
    }

    public boolean isHeld(String name) {
        return held.contains(name);
    }

    private static void closeQuietly(FileChannel channel, String name) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("[LOCK] error closing channel for {}: {}", name, e.getMessage());
        }
    }
}
