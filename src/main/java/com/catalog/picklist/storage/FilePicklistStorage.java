package com.catalog.picklist.storage;

import com.catalog.picklist.model.PicklistItem;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.service.PicklistPersistenceException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One pretty-printed JSON array per vocabulary ({@code brands.json}, {@code categories.json}, ...).
 * Writes go to a temp file in the same directory and are moved over the target, so readers
 * never see a half-written file. Missing files fall back to the classpath seed under {@code picklists/}.
 */
@Component
@ConditionalOnProperty(name = "app.picklist.storage.mode", havingValue = "file", matchIfMissing = true)
public class FilePicklistStorage implements PicklistStorage {

    private static final Logger logger = LoggerFactory.getLogger(FilePicklistStorage.class);

    static final String SEED_LOCATION = "picklists/";

    private final ObjectMapper objectMapper;
    private final Path directory;

    public FilePicklistStorage(ObjectMapper objectMapper,
                               @Value("${app.picklist.storage.dir:./data/picklists}") String directory) {
        this.objectMapper = objectMapper;
        this.directory = Paths.get(directory);
    }

    @Override
    public List<PicklistItem> load(PicklistType type) {
        Path file = fileFor(type);
        JavaType listType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, type.getItemClass());
        try {
            if (Files.exists(file)) {
                List<PicklistItem> items = objectMapper.readValue(file.toFile(), listType);
                logger.info("Loaded {} {} from {}", items.size(), type.getCollectionKey(), file);
                return new ArrayList<>(items);
            }
            ClassPathResource seed = new ClassPathResource(SEED_LOCATION + fileName(type));
            if (!seed.exists()) {
                logger.warn("No {} file at {} and no classpath seed; starting empty", type.getCollectionKey(), file);
                return new ArrayList<>();
            }
            try (InputStream in = seed.getInputStream()) {
                List<PicklistItem> items = objectMapper.readValue(in, listType);
                logger.info("Loaded {} {} from classpath seed", items.size(), type.getCollectionKey());
                return new ArrayList<>(items);
            }
        } catch (IOException e) {
            throw new PicklistPersistenceException("Failed to read " + type.getCollectionKey() + " from " + file, e);
        }
    }

    @Override
    public void save(PicklistType type, List<? extends PicklistItem> items) {
        Path target = fileFor(type);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, type.getCollectionKey(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), items);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Wrote {} {} to {}", items.size(), type.getCollectionKey(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PicklistPersistenceException("Failed to write " + type.getCollectionKey() + " to " + target, e);
        }
    }

    Path fileFor(PicklistType type) {
        return directory.resolve(fileName(type));
    }

    private static String fileName(PicklistType type) {
        return type.getCollectionKey() + ".json";
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
