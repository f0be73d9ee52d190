package com.kbase;

import com.kbase.index.ItemIndex;
import com.kbase.mapping.DefinitionFieldMapper;
import com.kbase.mapping.FieldMapper;
import com.kbase.models.BaseKind;
import com.kbase.models.CreateItemRequest;
import com.kbase.models.Item;
import com.kbase.models.ItemQuery;
import com.kbase.models.ItemSummary;
import com.kbase.models.Priority;
import com.kbase.models.Status;
import com.kbase.models.TypeChangeResult;
import com.kbase.models.TypeDefinition;
import com.kbase.models.UpdateItemRequest;
import com.kbase.storage.FileStore;
import com.kbase.storage.StorageConfig;
import com.kbase.storage.StoredDocument;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the item files and the secondary index in step.
 *
 * <p>Every write goes to the file first. The index projection follows; if it fails the file stays
 * authoritative and {@link #rebuild(String)} brings the index back in line.</p>
 */
public class ItemSynchronizer {

    private static final int MAX_SEQUENCE_ATTEMPTS = 1000;

    private final FileStore fileStore;
    private final TypeRegistry typeRegistry;
    private final TagRegistry tagRegistry;
    private final StatusRegistry statusRegistry;
    private final ItemIndex index;
    private final Clock clock;
    private final ZoneId zone;

    public ItemSynchronizer(FileStore fileStore, TypeRegistry typeRegistry, TagRegistry tagRegistry,
                            StatusRegistry statusRegistry, ItemIndex index, Clock clock, ZoneId zone) {
        this.fileStore = fileStore;
        this.typeRegistry = typeRegistry;
        this.tagRegistry = tagRegistry;
        this.statusRegistry = statusRegistry;
        this.index = index;
        this.clock = clock;
        this.zone = zone;
    }

    // ----- create -----

    public Item create(CreateItemRequest request) {
        String type = request.getType();
        BaseKind kind = resolveKind(type);

        String content = request.getContent();
        if (kind.isContentRequired() && (content == null || content.trim().isEmpty())) {
            throw KnowledgeBaseException.invalid("Content is required for type " + type);
        }

        Item item = new Item(type, null);
        item.setTitle(ItemRules.normalizeTitle(request.getTitle()));
        item.setDescription(ItemRules.emptyToNull(request.getDescription()));
        item.setContent(content);
        item.setStartDate(ItemRules.validateDate("start_date", request.getStartDate()));
        item.setEndDate(ItemRules.validateDate("end_date", request.getEndDate()));
        String date = ItemRules.validateDate("date", request.getDate());
        if (kind.isRegistrable()) {
            item.setVersion(ItemRules.emptyToNull(request.getVersion()));
        }

        if (kind.hasWorkflow()) {
            item.setPriority(request.getPriority() != null ? request.getPriority() : Priority.MEDIUM);
            Status status = resolveStatus(request.getStatus() != null ? request.getStatus() : StatusRegistry.DEFAULT_STATUS);
            item.setStatus(status.getName());
            item.setStatusId(status.getId());
        }

        item.setTags(ItemRules.cleanTags(request.getTags()));
        item.setRelated(ItemRules.cleanReferences(
            request.getRelated(), request.getRelatedTasks(), request.getRelatedDocuments()));
        applyRelationViews(item);

        Instant now = clock.instant();
        String nowStamp = ItemRules.timestamp(now);
        item.setCreatedAt(nowStamp);
        item.setUpdatedAt(nowStamp);

        StorageConfig config = StorageConfig.forType(type, kind);
        FieldMapper mapper = mapperFor(type, kind);

        switch (kind.getIdStrategy()) {
            case TIMESTAMP:
                createSession(request, item, config, mapper);
                break;
            case DATE:
                createDaily(date != null ? date : item.getStartDate(), item, config, mapper);
                break;
            default:
                createSequenced(item, kind, config, mapper);
        }

        project(item);
        registerTags(item.getTags());
        log("Created " + item.reference());
        return item.copy();
    }

    private void createSession(CreateItemRequest request, Item item, StorageConfig config, FieldMapper mapper) {
        String id = request.getId();
        if (id != null) {
            ItemRules.validateSessionId(id);
        } else {
            Instant at = request.getDatetime() != null ? request.getDatetime() : clock.instant();
            id = ItemRules.sessionId(at, zone);
        }
        item.setId(id);
        item.setStartDate(id.substring(0, 10));
        item.setStartTime(ItemRules.sessionTime(id));
        item.setEndDate(null);
        ItemRules.rejectSelfReference(item.reference(), item.getRelated());
        if (!writeExclusive(config, mapper, item)) {
            throw KnowledgeBaseException.invalid("Session " + id + " already exists. Use update instead.");
        }
    }

    private void createDaily(String date, Item item, StorageConfig config, FieldMapper mapper) {
        if (date != null) {
            item.setCreatedAt(date + "T00:00:00.000Z");
        } else {
            date = LocalDate.ofInstant(clock.instant(), zone).toString();
        }
        item.setId(date);
        item.setStartDate(date);
        item.setEndDate(null);
        ItemRules.rejectSelfReference(item.reference(), item.getRelated());
        if (!writeExclusive(config, mapper, item)) {
            throw KnowledgeBaseException.invalid("Daily summary for " + date + " already exists. Use update instead.");
        }
    }

    private void createSequenced(Item item, BaseKind kind, StorageConfig config, FieldMapper mapper) {
        for (int attempt = 0; attempt < MAX_SEQUENCE_ATTEMPTS; attempt++) {
            item.setId(String.valueOf(typeRegistry.nextSequenceValue(item.getType())));
            ItemRules.rejectSelfReference(item.reference(), item.getRelated());
            if (writeExclusive(config, mapper, item)) {
                return;
            }
            logWarning("File for " + item.reference() + " already exists; sequence for " + item.getType()
                + " is behind the files, skipping ahead");
        }
        throw KnowledgeBaseException.internal("Could not allocate an id for type " + item.getType()
            + "; rebuild the index to resync its sequence", null);
    }

    // ----- update -----

    public Item update(UpdateItemRequest request) {
        String type = request.getType();
        BaseKind kind = resolveKind(type);
        Item current = get(type, request.getId());
        Item item = current.copy();

        if (request.getTitle() != null) {
            item.setTitle(ItemRules.normalizeTitle(request.getTitle()));
        }
        if (request.getDescription() != null) {
            item.setDescription(ItemRules.emptyToNull(request.getDescription()));
        }
        if (request.getContent() != null) {
            if (kind.isContentRequired() && request.getContent().trim().isEmpty()) {
                throw KnowledgeBaseException.invalid("Content is required for type " + type);
            }
            item.setContent(request.getContent());
        }
        if (kind.hasWorkflow()) {
            if (request.getPriority() != null) {
                item.setPriority(request.getPriority());
            }
            if (request.getStatus() != null) {
                Status status = resolveStatus(request.getStatus());
                item.setStatus(status.getName());
                item.setStatusId(status.getId());
            }
        }
        if (request.getStartDate() != null) {
            String startDate = ItemRules.validateDate("start_date", request.getStartDate());
            if (kind.isDateKeyed()) {
                if (startDate != null && !startDate.equals(current.getStartDate())) {
                    throw KnowledgeBaseException.invalid("start_date of " + type + " is fixed by the id");
                }
            } else {
                item.setStartDate(startDate);
            }
        }
        if (request.getEndDate() != null && !kind.isDateKeyed()) {
            item.setEndDate(ItemRules.validateDate("end_date", request.getEndDate()));
        }
        if (request.getVersion() != null && kind.isRegistrable()) {
            item.setVersion(ItemRules.emptyToNull(request.getVersion()));
        }
        if (request.getTags() != null) {
            item.setTags(ItemRules.cleanTags(request.getTags()));
        }
        if (request.getRelated() != null || request.getRelatedTasks() != null || request.getRelatedDocuments() != null) {
            item.setRelated(mergeRelated(current, request));
            applyRelationViews(item);
        }
        ItemRules.rejectSelfReference(item.reference(), item.getRelated());

        item.setUpdatedAt(ItemRules.timestamp(clock.instant()));

        StorageConfig config = StorageConfig.forType(type, kind);
        try {
            fileStore.save(config, toDocument(mapperFor(type, kind), item));
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Failed to write " + item.reference() + ": " + e.getMessage(), e);
        }
        project(item);
        registerTags(item.getTags());
        log("Updated " + item.reference());
        return item.copy();
    }

    /**
     * A supplied {@code related} replaces the set; supplied views replace their half; the result is their union.
     */
    private List<String> mergeRelated(Item current, UpdateItemRequest request) {
        List<String> base = request.getRelated() != null
            ? ItemRules.cleanReferences(request.getRelated())
            : current.getRelated();
        if (request.getRelatedTasks() == null && request.getRelatedDocuments() == null) {
            return base;
        }
        Item split = new Item(current.getType(), current.getId());
        split.setRelated(base);
        applyRelationViews(split);
        List<String> tasks = request.getRelatedTasks() != null
            ? ItemRules.cleanReferences(request.getRelatedTasks())
            : split.getRelatedTasks();
        List<String> documents = request.getRelatedDocuments() != null
            ? ItemRules.cleanReferences(request.getRelatedDocuments())
            : split.getRelatedDocuments();
        return ItemRules.cleanReferences(tasks, documents);
    }

    // ----- delete / get / list -----

    /**
     * @return false when no file existed for the item
     */
    public boolean delete(String type, String id) {
        BaseKind kind = resolveKind(type);
        requireValidId(kind, id);
        boolean deleted = fileStore.delete(StorageConfig.forType(type, kind), id);
        if (!deleted) {
            return false;
        }
        try {
            index.remove(type, id);
        } catch (RuntimeException e) {
            throw KnowledgeBaseException.internal("Deleted " + type + "-" + id
                + " but the index update failed; run rebuild for " + type, e);
        }
        log("Deleted " + type + "-" + id);
        return true;
    }

    /**
     * Reads the item from its file.
     */
    public Item get(String type, String id) {
        BaseKind kind = resolveKind(type);
        requireValidId(kind, id);
        Optional<StoredDocument> doc;
        try {
            doc = fileStore.load(StorageConfig.forType(type, kind), id);
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Failed to read " + type + "-" + id + ": " + e.getMessage(), e);
        }
        if (doc.isEmpty()) {
            throw KnowledgeBaseException.notFound(type + " with id " + id + " not found");
        }
        Item item = mapperFor(type, kind).fromStorage(doc.get());
        reresolveStatus(item, kind);
        applyRelationViews(item);
        return item;
    }

    /**
     * Lists a type from the index. Status names are the ones cached when each row was written.
     */
    public List<ItemSummary> list(ItemQuery query) {
        BaseKind kind = resolveKind(query.getType());
        ItemRules.validateDate("start_date", query.getStartDate());
        ItemRules.validateDate("end_date", query.getEndDate());
        return index.list(query, kind.isDateKeyed());
    }

    public List<ItemSummary> listByTag(String tag, Collection<String> types) {
        if (tag == null || tag.trim().isEmpty()) {
            throw KnowledgeBaseException.invalid("Tag is required");
        }
        requireKnownTypes(types);
        return index.listByTag(tag.trim(), types);
    }

    public List<ItemSummary> search(String query, Collection<String> types, int limit, int offset) {
        if (query == null || query.trim().isEmpty()) {
            throw KnowledgeBaseException.invalid("Search query is required");
        }
        requireKnownTypes(types);
        return index.search(query, types, limit, offset);
    }

    // ----- rebuild -----

    /**
     * Re-derives the index rows of one type from its files.
     *
     * @return number of items projected
     */
    public int rebuild(String type) {
        BaseKind kind = resolveKind(type);
        StorageConfig config = StorageConfig.forType(type, kind);
        FieldMapper mapper = mapperFor(type, kind);

        List<String> ids;
        try {
            ids = fileStore.list(config);
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Failed to list files of " + type + ": " + e.getMessage(), e);
        }

        index.clearType(type);
        int synced = 0;
        long maxId = 0;
        Set<String> tags = new LinkedHashSet<>();
        for (String id : ids) {
            try {
                Optional<StoredDocument> doc = fileStore.load(config, id);
                if (doc.isEmpty()) {
                    continue;
                }
                Item item = mapper.fromStorage(doc.get());
                if (item.getTitle() == null) {
                    logWarning("Skipping " + type + "-" + id + ": no title");
                    continue;
                }
                reresolveStatus(item, kind);
                applyRelationViews(item);
                index.project(item);
                tags.addAll(item.getTags());
                synced++;
                if (kind.getIdStrategy() == BaseKind.IdStrategy.SEQUENCE) {
                    maxId = Math.max(maxId, numericId(id));
                }
            } catch (IOException | RuntimeException e) {
                logWarning("Skipping " + type + "-" + id + ": " + e.getMessage());
            }
        }
        registerTags(tags);
        if (maxId > 0) {
            typeRegistry.raiseSequenceTo(type, maxId);
        }
        log("Rebuilt " + type + ": " + synced + " of " + ids.size() + " files");
        return synced;
    }

    // ----- type lifecycle -----

    /**
     * Moves an item to another type of the same base kind, rewriting references held by other items.
     */
    public TypeChangeResult changeType(String fromType, String fromId, String toType) {
        BaseKind fromKind = resolveKind(fromType);
        BaseKind toKind = resolveKind(toType);
        if (fromKind.isDateKeyed() || toKind.isDateKeyed()) {
            throw KnowledgeBaseException.invalid("Sessions and dailies cannot change type");
        }
        if (fromKind != toKind) {
            throw KnowledgeBaseException.invalid("Cannot change " + fromType + " (" + fromKind.getKey() + ") to "
                + toType + " (" + toKind.getKey() + "): base types differ");
        }
        if (fromType.equals(toType)) {
            throw KnowledgeBaseException.invalid("Item is already of type " + toType);
        }

        Item source = get(fromType, fromId);
        String oldReference = source.reference();
        CreateItemRequest request = new CreateItemRequest(toType)
            .title(source.getTitle())
            .description(source.getDescription())
            .content(source.getContent())
            .priority(source.getPriority())
            .status(source.getStatus())
            .startDate(source.getStartDate())
            .endDate(source.getEndDate())
            .version(source.getVersion())
            .tags(source.getTags())
            .related(source.getRelated());
        Item created = create(request);
        String newReference = created.reference();

        int rewritten = 0;
        for (ItemSummary referrer : index.referencing(fromType, fromId)) {
            if (referrer.getType().equals(fromType) && referrer.getId().equals(fromId)) {
                continue;
            }
            try {
                Item other = get(referrer.getType(), referrer.getId());
                List<String> related = new ArrayList<>();
                for (String reference : other.getRelated()) {
                    String replaced = reference.equals(oldReference) ? newReference : reference;
                    if (!related.contains(replaced) && !replaced.equals(other.reference())) {
                        related.add(replaced);
                    }
                }
                update(new UpdateItemRequest(other.getType(), other.getId()).related(related));
                rewritten++;
            } catch (KnowledgeBaseException e) {
                logWarning("Could not rewrite reference in " + referrer.getType() + "-" + referrer.getId()
                    + ": " + e.getMessage());
            }
        }

        delete(fromType, fromId);
        log("Changed " + oldReference + " to " + newReference + " (" + rewritten + " references updated)");
        return new TypeChangeResult(created, rewritten);
    }

    /**
     * Unregisters an empty custom type and drops whatever index rows it still has.
     */
    public void deleteType(String name) {
        if (TypeRegistry.SESSIONS.equals(name) || TypeRegistry.DAILIES.equals(name)) {
            throw KnowledgeBaseException.invalid("Type " + name + " is built in and cannot be deleted");
        }
        TypeDefinition definition = typeRegistry.getType(name)
            .orElseThrow(() -> KnowledgeBaseException.notFound("Type " + name + " not found"));
        List<String> ids;
        try {
            ids = fileStore.list(StorageConfig.forType(name, definition.getBaseKind()));
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Failed to list files of " + name + ": " + e.getMessage(), e);
        }
        if (!ids.isEmpty()) {
            throw KnowledgeBaseException.invalid("Type " + name + " still has " + ids.size()
                + (ids.size() == 1 ? " item" : " items") + "; delete them first");
        }
        index.clearType(name);
        typeRegistry.unregisterType(name);
        log("Deleted type " + name);
    }

    // ----- helpers -----

    private BaseKind resolveKind(String type) {
        return typeRegistry.baseKindOf(type)
            .orElseThrow(() -> KnowledgeBaseException.invalid("Unknown type: " + type));
    }

    private void requireKnownTypes(Collection<String> types) {
        if (types == null) {
            return;
        }
        for (String type : types) {
            resolveKind(type);
        }
    }

    /**
     * Session and daily ids must carry their date, since it names the file's partition.
     */
    private static void requireValidId(BaseKind kind, String id) {
        if (kind == BaseKind.SESSIONS) {
            ItemRules.validateSessionId(id);
        } else if (kind == BaseKind.DAILIES && (id == null || id.isEmpty())) {
            throw KnowledgeBaseException.invalid("Invalid id: daily summaries are keyed by YYYY-MM-DD");
        } else if (kind == BaseKind.DAILIES) {
            ItemRules.validateDate("id", id);
        } else if (!FileStore.isValidId(id)) {
            throw KnowledgeBaseException.invalid("Invalid id: " + id);
        }
    }

    private FieldMapper mapperFor(String type, BaseKind kind) {
        return new DefinitionFieldMapper(type, kind, typeRegistry.fieldsOf(type));
    }

    private Status resolveStatus(String name) {
        return statusRegistry.byName(name)
            .orElseThrow(() -> KnowledgeBaseException.invalid("Unknown status: " + name));
    }

    /**
     * Takes the status name from {@code status_id}, or the id from the name when only that is stored.
     */
    private void reresolveStatus(Item item, BaseKind kind) {
        if (!kind.hasWorkflow()) {
            return;
        }
        if (item.getStatusId() != null) {
            statusRegistry.byId(item.getStatusId()).ifPresent(status -> item.setStatus(status.getName()));
        } else if (item.getStatus() != null) {
            statusRegistry.byName(item.getStatus()).ifPresent(status -> item.setStatusId(status.getId()));
        }
    }

    /**
     * Splits {@code related} into the task and document views by the base kind of each referenced type.
     */
    private void applyRelationViews(Item item) {
        List<String> tasks = new ArrayList<>();
        List<String> documents = new ArrayList<>();
        for (String reference : item.getRelated()) {
            Optional<BaseKind> kind = typeRegistry.baseKindOf(ItemRules.referenceType(reference));
            if (kind.isPresent() && kind.get() == BaseKind.TASKS) {
                tasks.add(reference);
            } else {
                documents.add(reference);
            }
        }
        item.setRelatedTasks(tasks);
        item.setRelatedDocuments(documents);
    }

    private boolean writeExclusive(StorageConfig config, FieldMapper mapper, Item item) {
        try {
            return fileStore.createExclusive(config, toDocument(mapper, item));
        } catch (IOException e) {
            throw KnowledgeBaseException.internal("Failed to write " + item.reference() + ": " + e.getMessage(), e);
        }
    }

    private static StoredDocument toDocument(FieldMapper mapper, Item item) {
        return new StoredDocument(item.getId(), mapper.toStorage(item), item.getContent());
    }

    private void project(Item item) {
        try {
            index.project(item);
        } catch (RuntimeException e) {
            logError("Index update failed for " + item.reference(), e);
            throw KnowledgeBaseException.internal("Saved " + item.reference()
                + " but the index update failed; run rebuild for " + item.getType(), e);
        }
    }

    private void registerTags(Collection<String> tags) {
        try {
            tagRegistry.ensureExist(tags);
        } catch (RuntimeException e) {
            logWarning("Failed to register tags " + tags + ": " + e.getMessage());
        }
    }

    private static long numericId(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ItemSynchronizer] " + message);
        } else {
            System.out.println("[ItemSynchronizer] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[ItemSynchronizer] " + message);
        } else {
            System.out.println("[ItemSynchronizer] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[ItemSynchronizer] " + message, t);
        } else {
            System.out.println("[ItemSynchronizer] " + message + ": " + t.getMessage());
        }
    }
}
