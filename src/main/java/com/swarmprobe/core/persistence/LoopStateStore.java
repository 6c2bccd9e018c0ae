package com.swarmprobe.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.model.LoopState;
import com.swarmprobe.core.model.StressParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;

/**
 * Reads and writes {@link LoopState} as a JSON file. Writes go to a sibling temp file that
 * is then moved over the target, so readers never see a partial file.
 */
public class LoopStateStore {

    private static final Logger log = LoggerFactory.getLogger(LoopStateStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LoopStateStore(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    /**
     * The persisted state, or a fresh one when the file is missing, unreadable, or written
     * by an incompatible version.
     */
    public LoopState loadOrCreate(StressParameters stress) {
        return read().orElseGet(() -> {
            var fresh = LoopState.initial(clock.instant(), stress);
            log.info("Starting fresh loop state {}", fresh.sessionId());
            return fresh;
        });
    }

    public Optional<LoopState> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            var state = objectMapper.readValue(path.toFile(), LoopState.class);
            if (state == null) {
                log.warn("State file {} holds no state, starting fresh", path);
                return Optional.empty();
            }
            if (state.version() != LoopState.CURRENT_VERSION) {
                log.warn("Ignoring state file {} with version {}", path, state.version());
                return Optional.empty();
            }
            return Optional.of(state);
        } catch (IOException e) {
            log.warn("Failed to read state file {}, starting fresh: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(LoopState state) {
        try {
            var dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            var tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state file " + path, e);
        }
    }
}
