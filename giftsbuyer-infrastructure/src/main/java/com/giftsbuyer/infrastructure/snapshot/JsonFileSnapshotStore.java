package com.giftsbuyer.infrastructure.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.giftsbuyer.application.ports.SnapshotStoreException;
import com.giftsbuyer.application.ports.SnapshotStorePort;
import com.giftsbuyer.domain.gift.Gift;
import com.giftsbuyer.domain.gift.GiftCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot as a JSON array of gift records.
 *
 * Writes go to a temp file in the same directory, then replace the target by rename,
 * so a crash never leaves a half-written snapshot behind.
 */
public class JsonFileSnapshotStore implements SnapshotStorePort {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);
    private static final TypeReference<List<GiftRecord>> RECORDS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper om;

    public JsonFileSnapshotStore(Path file) {
        this(file, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    JsonFileSnapshotStore(Path file, ObjectMapper om) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.om = Objects.requireNonNull(om, "om");
    }

    public Path file() {
        return file;
    }

    @Override
    public GiftCatalog load() {
        if (!Files.exists(file)) {
            log.info("No snapshot at {}, starting with an empty catalog", file);
            return GiftCatalog.empty();
        }
        try {
            List<GiftRecord> records = om.readValue(file.toFile(), RECORDS);
            List<Gift> gifts = new ArrayList<>(records == null ? 0 : records.size());
            if (records != null) {
                for (GiftRecord r : records) {
                    if (r != null) gifts.add(r.toGift());
                }
            }
            return GiftCatalog.of(gifts);
        } catch (IOException | RuntimeException e) {
            throw new SnapshotStoreException("Cannot read snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(List<Gift> gifts) {
        List<GiftRecord> records = new ArrayList<>(gifts.size());
        for (Gift g : gifts) records.add(GiftRecord.from(g));

        Path dir = file.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            om.writeValue(tmp.toFile(), records);
            replace(tmp);
            log.debug("Snapshot saved: {} gift(s) -> {}", records.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new SnapshotStoreException("Cannot write snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    private void replace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Cannot delete temp snapshot {}: {}", tmp, e.getMessage());
        }
    }
}
