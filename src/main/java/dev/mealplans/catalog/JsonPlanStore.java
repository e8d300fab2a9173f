package dev.mealplans.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mealplans.engine.PlanCodec;
import dev.mealplans.model.Plan;
import dev.mealplans.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores plans as {@code plan-<id>.json} files in a directory, with an {@code index.json}
 * listing what is stored. Writes go through a temporary file and a move.
 */
public final class JsonPlanStore implements PlanSink {

    private static final Logger log = LoggerFactory.getLogger(JsonPlanStore.class);

    static final String INDEX_FILE = "index.json";

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .registerModule(new JavaTimeModule());

    private final Path directory;
    private final Clock clock;

    public JsonPlanStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    JsonPlanStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    @Override
    public synchronized long save(Plan plan, UserProfile user) throws IOException {
        Files.createDirectories(directory);
        List<StoredPlanEntry> index = new ArrayList<>(entries());
        long id = index.stream().mapToLong(StoredPlanEntry::id).max().orElse(0L) + 1;
        String email = user != null ? user.email() : plan.userEmail();

        writeAtomically(planFile(id), PlanCodec.toJsonString(plan));
        index.add(new StoredPlanEntry(id, email, plan.title(), clock.instant()));
        writeIndex(index);
        log.info("Saved plan {} '{}' for {}", id, plan.title(), email);
        return id;
    }

    @Override
    public Optional<Plan> export(long planId) throws IOException {
        Path file = planFile(planId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(PlanCodec.fromString(Files.readString(file, StandardCharsets.UTF_8)));
    }

    @Override
    public synchronized void replace(long planId, Plan plan) throws IOException {
        Path file = planFile(planId);
        if (!Files.exists(file)) {
            throw new IOException("No stored plan with id " + planId);
        }
        writeAtomically(file, PlanCodec.toJsonString(plan));

        List<StoredPlanEntry> index = new ArrayList<>(entries());
        index.replaceAll(e -> e.id() == planId
            ? new StoredPlanEntry(planId, e.userEmail(), plan.title(), clock.instant())
            : e);
        writeIndex(index);
        log.info("Replaced plan {} with '{}'", planId, plan.title());
    }

    /** Index entries in save order. */
    public List<StoredPlanEntry> entries() throws IOException {
        Path index = directory.resolve(INDEX_FILE);
        if (!Files.exists(index)) {
            return List.of();
        }
        try {
            return mapper.readValue(index.toFile(), new TypeReference<List<StoredPlanEntry>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse plan index " + index, ex);
        }
    }

    private void writeIndex(List<StoredPlanEntry> index) throws IOException {
        writeAtomically(directory.resolve(INDEX_FILE), mapper.writeValueAsString(index));
    }

    private Path planFile(long id) {
        return directory.resolve("plan-" + id + ".json");
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        Files.writeString(temp, content, StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, replacing in place", directory);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
