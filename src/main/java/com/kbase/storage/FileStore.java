package com.kbase.storage;

import com.kbase.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Authoritative store: one Markdown file per item under the data directory.
 */
public class FileStore {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern PARTITION_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    /**
     * Numeric ids in numeric order, everything else lexicographically after them.
     */
    public static final Comparator<String> ID_ORDER = (a, b) -> {
        boolean aNumeric = isNumeric(a);
        boolean bNumeric = isNumeric(b);
        if (aNumeric && bNumeric) {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    };

    private final Path dataDir;

    public FileStore(Path dataDir) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
    }

    public Path getDataDir() {
        return dataDir;
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches() && !id.contains("..");
    }

    /**
     * Writes the item file, replacing any existing one.
     */
    public void save(StorageConfig config, StoredDocument doc) throws IOException {
        Path target = resolve(config, doc.getId());
        Files.createDirectories(target.getParent());
        String text = MarkdownCodec.encode(doc.getMetadata(), doc.getBody());

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(temp, text, StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Writes the item file only if none exists for the id.
     *
     * @return false when a file for the id was already there
     */
    public boolean createExclusive(StorageConfig config, StoredDocument doc) throws IOException {
        Path target = resolve(config, doc.getId());
        Files.createDirectories(target.getParent());
        String text = MarkdownCodec.encode(doc.getMetadata(), doc.getBody());
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    public Optional<StoredDocument> load(StorageConfig config, String id) throws IOException {
        Path path = resolve(config, id);
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            return Optional.of(MarkdownCodec.decode(id, text));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    public boolean exists(StorageConfig config, String id) {
        return Files.isRegularFile(resolve(config, id));
    }

    /**
     * Removes the item file. Returns false when there was nothing to remove or the removal failed.
     */
    public boolean delete(StorageConfig config, String id) {
        Path path = resolve(config, id);
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted && config.isDatePartitioned()) {
                removeIfEmpty(path.getParent());
            }
            return deleted;
        } catch (IOException e) {
            logWarning("Failed to delete " + path + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Ids of every file of the type, across all partitions for partitioned types.
     */
    public List<String> list(StorageConfig config) throws IOException {
        if (!config.isDatePartitioned()) {
            return listDirectory(config, baseDir(config));
        }
        List<String> ids = new ArrayList<>();
        for (String partition : listPartitions(config)) {
            ids.addAll(listDirectory(config, baseDir(config).resolve(partition)));
        }
        ids.sort(ID_ORDER);
        return ids;
    }

    public List<String> list(StorageConfig config, String partition) throws IOException {
        if (!config.isDatePartitioned() || partition == null) {
            return list(config);
        }
        if (!PARTITION_PATTERN.matcher(partition).matches()) {
            throw new IllegalArgumentException("Invalid partition: " + partition);
        }
        return listDirectory(config, baseDir(config).resolve(partition));
    }

    public List<String> listPartitions(StorageConfig config) throws IOException {
        List<String> partitions = new ArrayList<>();
        Path base = baseDir(config);
        if (!config.isDatePartitioned() || !Files.isDirectory(base)) {
            return partitions;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(base, Files::isDirectory)) {
            for (Path dir : stream) {
                String name = dir.getFileName().toString();
                if (PARTITION_PATTERN.matcher(name).matches()) {
                    partitions.add(name);
                }
            }
        }
        partitions.sort(Comparator.naturalOrder());
        return partitions;
    }

    /**
     * Names of the top-level directories of the data directory, hidden ones excluded.
     */
    public List<String> listTopLevelDirectories() throws IOException {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, Files::isDirectory)) {
            for (Path dir : stream) {
                String name = dir.getFileName().toString();
                if (!name.startsWith(".")) {
                    names.add(name);
                }
            }
        }
        names.sort(Comparator.naturalOrder());
        return names;
    }

    Path resolve(StorageConfig config, String id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid item id: " + id);
        }
        Path dir = baseDir(config);
        String partition = config.partitionOf(id);
        if (partition != null) {
            dir = dir.resolve(partition);
        }
        return dir.resolve(config.fileName(id));
    }

    private Path baseDir(StorageConfig config) {
        return dataDir.resolve(config.getBaseDir());
    }

    private List<String> listDirectory(StorageConfig config, Path dir) throws IOException {
        List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return ids;
        }
        String prefix = config.getPrefix();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (!name.startsWith(prefix) || !name.endsWith(StorageConfig.EXTENSION)) {
                    continue;
                }
                String id = name.substring(prefix.length(), name.length() - StorageConfig.EXTENSION.length());
                if (isValidId(id)) {
                    ids.add(id);
                }
            }
        }
        ids.sort(ID_ORDER);
        return ids;
    }

    private void removeIfEmpty(Path dir) {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            if (stream.iterator().hasNext()) {
                return;
            }
        } catch (IOException e) {
            return;
        }
        try {
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            logWarning("Could not remove empty partition " + dir + ": " + e.getMessage());
        }
    }

    private static boolean isNumeric(String id) {
        if (id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[FileStore] " + message);
        } else {
            System.out.println("[FileStore] " + message);
        }
    }
}
