package com.kbase;

import com.kbase.index.IndexDatabase;
import com.kbase.index.ItemIndex;
import com.kbase.storage.FileStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Holder for the services of one data directory and its index.
 */
public class KnowledgeBase implements AutoCloseable {

    private final IndexDatabase database;
    private final FileStore fileStore;
    private final TypeRegistry typeRegistry;
    private final TagRegistry tagRegistry;
    private final StatusRegistry statusRegistry;
    private final ItemIndex itemIndex;
    private final ItemSynchronizer synchronizer;
    private final IndexRebuilder rebuilder;

    private KnowledgeBase(Path dataDirectory, Path databasePath, Clock clock, ZoneId zone) {
        this.database = new IndexDatabase(databasePath);
        database.open();
        this.fileStore = new FileStore(dataDirectory);
        this.typeRegistry = new TypeRegistry(database);
        this.tagRegistry = new TagRegistry(database);
        this.statusRegistry = new StatusRegistry(database);
        this.itemIndex = new ItemIndex(database);
        this.synchronizer = new ItemSynchronizer(fileStore, typeRegistry, tagRegistry, statusRegistry, itemIndex,
            clock, zone);
        this.rebuilder = new IndexRebuilder(fileStore, typeRegistry, synchronizer);
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[KnowledgeBase] Loaded " + fileStore.getDataDir());
        }
    }

    public static KnowledgeBase open(AppConfig config) {
        return open(config.getDataDirectory(), config.getDatabasePath(), Clock.systemUTC(), config.getZone());
    }

    public static KnowledgeBase open(Path dataDirectory, Path databasePath, Clock clock, ZoneId zone) {
        return new KnowledgeBase(dataDirectory, databasePath, clock, zone);
    }

    public ItemSynchronizer items() {
        return synchronizer;
    }

    public TypeRegistry types() {
        return typeRegistry;
    }

    public TagRegistry tags() {
        return tagRegistry;
    }

    public StatusRegistry statuses() {
        return statusRegistry;
    }

    public IndexRebuilder rebuilder() {
        return rebuilder;
    }

    public FileStore files() {
        return fileStore;
    }

    public ItemIndex index() {
        return itemIndex;
    }

    @Override
    public void close() {
        database.close();
    }
}
