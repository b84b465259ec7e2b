package com.di.recalibrator.agent.deployment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Replaces a file so that readers see either the old content or the new content, never a
 * partial write: the bytes go to a temp file in the target's directory, are fsynced, and the
 * temp file is renamed over the target in one atomic move.
 */
@Slf4j
@Component
public class AtomicFileWriter {

    public void write(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            beforeRename(temp, target);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[ATOMIC] replaced {} ({} bytes)", target, content.length);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /** Hook between the durable temp write and the rename. */
    protected void beforeRename(Path temp, Path target) throws IOException {
    }
}
