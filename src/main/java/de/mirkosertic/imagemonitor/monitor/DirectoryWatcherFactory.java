package de.mirkosertic.imagemonitor.monitor;

@FunctionalInterface
public interface DirectoryWatcherFactory {

    DirectoryWatcher create(WatchConfig config);

    /**
     * Picks the implementation matching {@link WatchConfig#watchMode()}.
     */
    static DirectoryWatcherFactory byWatchMode() {
        return config -> switch (config.watchMode()) {
            case NATIVE -> new NativeDirectoryWatcher(config.directory(), config.pollInterval());
            case POLLING -> new PollingDirectoryWatcher(config.directory(), config.pollInterval());
        };
    }
}
