package de.mirkosertic.imagemonitor.monitor;

import java.nio.file.Path;

@FunctionalInterface
public interface FileCreatedListener {

    void onFileCreated(Path file);
}
