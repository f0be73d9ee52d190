package com.kbase.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbase.models.BaseKind;
import com.kbase.models.FieldDefinition;
import com.kbase.models.Item;
import com.kbase.models.Priority;
import com.kbase.storage.StoredDocument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link FieldMapper} driven by a type's field definition list, so custom types share the built-in storage code.
 */
public class DefinitionFieldMapper implements FieldMapper {

    public static final String BASE_KEY = "base";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final String type;
    private final BaseKind kind;
    private final List<FieldDefinition> fields;

    public DefinitionFieldMapper(String type, BaseKind kind, List<FieldDefinition> fields) {
        this.type = type;
        this.kind = kind;
        this.fields = fields;
    }

    @Override
    public Map<String, Object> toStorage(Item item) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (kind.isRegistrable()) {
            metadata.put(BASE_KEY, kind.getKey());
        }
        for (FieldDefinition field : fields) {
            String name = field.getName();
            switch (name) {
                case "content":
                    break;
                case "id":
                    metadata.put(name, idValue(item.getId()));
                    break;
                case "title":
                    metadata.put(name, item.getTitle());
                    break;
                case "description":
                    metadata.put(name, item.getDescription());
                    break;
                case "priority":
                    if (kind.hasWorkflow()) {
                        metadata.put(name, item.getPriority() != null ? item.getPriority().key() : field.getDefaultValue());
                    }
                    break;
                case "status":
                    if (kind.hasWorkflow()) {
                        metadata.put(name, item.getStatus() != null ? item.getStatus() : field.getDefaultValue());
                    }
                    break;
                case "status_id":
                    if (kind.hasWorkflow()) {
                        metadata.put(name, item.getStatusId());
                    }
                    break;
                case "start_date":
                    metadata.put(name, item.getStartDate());
                    break;
                case "end_date":
                    metadata.put(name, item.getEndDate());
                    break;
                case "start_time":
                    metadata.put(name, item.getStartTime());
                    break;
                case "version":
                    metadata.put(name, item.getVersion());
                    break;
                case "tags":
                    metadata.put(name, new ArrayList<>(item.getTags()));
                    break;
                case "related":
                    metadata.put(name, new ArrayList<>(item.getRelated()));
                    break;
                case "related_tasks":
                    metadata.put(name, new ArrayList<>(item.getRelatedTasks()));
                    break;
                case "related_documents":
                    metadata.put(name, new ArrayList<>(item.getRelatedDocuments()));
                    break;
                case "created_at":
                    metadata.put(name, item.getCreatedAt());
                    break;
                case "updated_at":
                    metadata.put(name, item.getUpdatedAt());
                    break;
                default:
                    metadata.put(name, defaultValueOf(field));
            }
        }
        return metadata;
    }

    @Override
    public Item fromStorage(StoredDocument doc) {
        Map<String, Object> metadata = doc.getMetadata();
        Item item = new Item(type, doc.getId());
        item.setTitle(text(metadata.get("title")));
        item.setDescription(text(metadata.get("description")));
        item.setContent(doc.getBody());

        if (kind.hasWorkflow()) {
            item.setPriority(Priority.fromKey(text(metadata.get("priority"))).orElse(Priority.MEDIUM));
            item.setStatus(text(metadata.get("status")));
            item.setStatusId(integer(metadata.get("status_id")));
        }

        item.setStartDate(text(metadata.get("start_date")));
        item.setEndDate(text(metadata.get("end_date")));
        item.setStartTime(text(metadata.get("start_time")));
        if (kind.isRegistrable()) {
            item.setVersion(text(metadata.get("version")));
        }
        if (kind.isDateKeyed() && item.getStartDate() == null && doc.getId().length() >= 10) {
            item.setStartDate(doc.getId().substring(0, 10));
        }
        if (kind == BaseKind.SESSIONS && item.getStartTime() == null && doc.getId().length() >= 19) {
            item.setStartTime(doc.getId().substring(11, 19).replace('.', ':'));
        }

        item.setTags(cleanStrings(metadata.get("tags")));
        Set<String> related = new LinkedHashSet<>(cleanStrings(metadata.get("related")));
        related.addAll(cleanStrings(metadata.get("related_tasks")));
        related.addAll(cleanStrings(metadata.get("related_documents")));
        item.setRelated(new ArrayList<>(related));

        item.setCreatedAt(text(metadata.get("created_at")));
        item.setUpdatedAt(text(metadata.get("updated_at")));
        return item;
    }

    public String getType() {
        return type;
    }

    public BaseKind getKind() {
        return kind;
    }

    private Object idValue(String id) {
        if (kind.getIdStrategy() == BaseKind.IdStrategy.SEQUENCE) {
            try {
                return Long.parseLong(id);
            } catch (NumberFormatException e) {
                return id;
            }
        }
        return id;
    }

    private static Object defaultValueOf(FieldDefinition field) {
        String value = field.getDefaultValue();
        if (value == null) {
            return null;
        }
        switch (field.getType()) {
            case TAGS:
            case RELATED:
                try {
                    return mapper.readValue(value, new TypeReference<List<String>>() {});
                } catch (JsonProcessingException e) {
                    return new ArrayList<String>();
                }
            case NUMBER:
                try {
                    return Long.parseLong(value.trim());
                } catch (NumberFormatException e) {
                    return value;
                }
            default:
                return value;
        }
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isEmpty() ? null : text;
    }

    private static Integer integer(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> cleanStrings(Object value) {
        Set<String> out = new LinkedHashSet<>();
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                if (element == null) {
                    continue;
                }
                String cleaned = element.toString().trim();
                if (!cleaned.isEmpty()) {
                    out.add(cleaned);
                }
            }
        } else if (value != null) {
            String cleaned = value.toString().trim();
            if (!cleaned.isEmpty()) {
                out.add(cleaned);
            }
        }
        return new ArrayList<>(out);
    }
}
