package com.kbase;

import com.kbase.mapping.DefinitionFieldMapper;
import com.kbase.models.BaseKind;
import com.kbase.models.RebuildReport;
import com.kbase.models.TypeDefinition;
import com.kbase.storage.FileStore;
import com.kbase.storage.StorageConfig;
import com.kbase.storage.StoredDocument;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recovers the whole index from the data directory: registers type directories the registry does not know,
 * then rebuilds every type.
 */
public class IndexRebuilder {

    private final FileStore fileStore;
    private final TypeRegistry typeRegistry;
    private final ItemSynchronizer synchronizer;

    public IndexRebuilder(FileStore fileStore, TypeRegistry typeRegistry, ItemSynchronizer synchronizer) {
        this.fileStore = fileStore;
        this.typeRegistry = typeRegistry;
        this.synchronizer = synchronizer;
    }

    public RebuildReport rebuildAll() {
        RebuildReport report = new RebuildReport();
        discoverTypes(report);
        for (TypeDefinition type : typeRegistry.listTypes()) {
            try {
                report.recordSynced(type.getName(), synchronizer.rebuild(type.getName()));
            } catch (RuntimeException e) {
                report.recordFailure(type.getName());
                logError("Rebuild of " + type.getName() + " failed", e);
            }
        }
        log("Rebuild finished: " + report.getTotalSynced() + " items across " + report.getSyncedByType().size()
            + " types");
        return report;
    }

    public RebuildReport rebuild(String type) {
        RebuildReport report = new RebuildReport();
        report.recordSynced(type, synchronizer.rebuild(type));
        return report;
    }

    private void discoverTypes(RebuildReport report) {
        List<String> directories;
        try {
            directories = fileStore.listTopLevelDirectories();
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Failed to scan " + fileStore.getDataDir() + ": " + e.getMessage(), e);
        }
        for (String name : directories) {
            if (!TypeRegistry.isValidName(name) || typeRegistry.typeExists(name)) {
                continue;
            }
            Optional<BaseKind> kind = inferKind(name);
            if (kind.isEmpty()) {
                continue;
            }
            typeRegistry.registerType(name, kind.get(), "Discovered during rebuild");
            report.recordRegistered(name);
            log("Registered " + name + " as " + kind.get().getKey() + " from existing files");
        }
    }

    /**
     * The {@code base} key of the first readable file decides. Without one, files carrying both priority and
     * status are tasks and anything else is a document. Empty when the directory holds no item files.
     */
    Optional<BaseKind> inferKind(String name) {
        StorageConfig config = StorageConfig.forType(name, BaseKind.DOCUMENTS);
        try {
            for (String id : fileStore.list(config)) {
                Optional<StoredDocument> doc = fileStore.load(config, id);
                if (doc.isEmpty()) {
                    continue;
                }
                Map<String, Object> metadata = doc.get().getMetadata();
                Object base = metadata.get(DefinitionFieldMapper.BASE_KEY);
                Optional<BaseKind> declared = BaseKind.fromKey(base != null ? base.toString() : null);
                if (declared.isPresent() && declared.get().isRegistrable()) {
                    return declared;
                }
                if (metadata.containsKey("priority") && metadata.containsKey("status")) {
                    return Optional.of(BaseKind.TASKS);
                }
                return Optional.of(BaseKind.DOCUMENTS);
            }
        } catch (IOException e) {
            logWarning("Could not inspect " + name + ": " + e.getMessage());
        }
        return Optional.empty();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[IndexRebuilder] " + message);
        } else {
            System.out.println("[IndexRebuilder] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IndexRebuilder] " + message);
        } else {
            System.out.println("[IndexRebuilder] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[IndexRebuilder] " + message, t);
        } else {
            System.out.println("[IndexRebuilder] " + message + ": " + t.getMessage());
        }
    }
}
