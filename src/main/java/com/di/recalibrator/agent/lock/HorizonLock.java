package com.di.recalibrator.agent.lock;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.util.Set;

/**
 * A held advisory lock. Closing releases both the OS file lock and the in-process claim.
 */
@Slf4j
public final class HorizonLock implements AutoCloseable {

    private final String name;
    private final FileChannel channel;
    private final FileLock fileLock;
    private final Set<String> heldNames;
    private boolean released;

    HorizonLock(String name, FileChannel channel, FileLock fileLock, Set<String> heldNames) {
        this.name = name;
        this.channel = channel;
        this.fileLock = fileLock;
        this.heldNames = heldNames;
    }

    public String getName() {
        return name;
    }

    @Override
    public synchronized void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            fileLock.release();
            channel.close();
        } catch (IOException e) {
            // The OS drops the lock with the channel; nothing else holds it.
            log.warn("[LOCK] error releasing {}: {}", name, e.getMessage());
        } finally {
            heldNames.remove(name);
            log.debug("[LOCK] released {}", name);
        }
    }
}
