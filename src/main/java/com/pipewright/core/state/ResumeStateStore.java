package com.pipewright.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resume state of one output directory, kept in memory during a run and persisted as JSON
 * at {@code <outputDir>/.pipewright/resume-state.json}.
 *
 * <p>A state file that cannot be read or parsed is logged and treated as empty, so a
 * corrupted cache only costs a full regeneration. Every public method is synchronized
 * because tasks of one dependency level record their outputs concurrently.
 */
public class ResumeStateStore {

    private static final Logger log = LoggerFactory.getLogger(ResumeStateStore.class);

    public static final String STATE_FILE = ".pipewright/resume-state.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final Path statePath;
    private String inputHash = "";
    private String configHash = "";
    private final Map<String, TaskOutputRecord> taskOutputs = new LinkedHashMap<>();

    public ResumeStateStore(Path outputDir) {
        this.statePath = outputDir.resolve(STATE_FILE);
    }

    public Path statePath() {
        return statePath;
    }

    /**
     * Loads persisted state, replacing whatever is in memory.
     *
     * @return true when a state file was found and parsed
     */
    public synchronized boolean load() {
        reset();
        ResumeState loaded;
        try {
            loaded = MAPPER.readValue(Files.readAllBytes(statePath), ResumeState.class);
        } catch (NoSuchFileException e) {
            log.debug("No resume state at {}, starting fresh", statePath);
            return false;
        } catch (IOException e) {
            log.warn("Ignoring unreadable resume state {}: {}", statePath, e.getMessage());
            return false;
        }
        inputHash = loaded.inputHash() != null ? loaded.inputHash() : "";
        configHash = loaded.configHash() != null ? loaded.configHash() : "";
        taskOutputs.putAll(loaded.taskOutputs());
        log.debug("Loaded resume state with {} recorded outputs", taskOutputs.size());
        return true;
    }

    /**
     * Writes the state atomically (temp file + move). Failures are logged, not thrown.
     *
     * @return true when the state was written
     */
    public synchronized boolean save() {
        try {
            Files.createDirectories(statePath.getParent());
            Path tmp = statePath.resolveSibling(statePath.getFileName() + ".tmp");
            MAPPER.writeValue(tmp.toFile(), state());
            Files.move(tmp, statePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (IOException e) {
            log.warn("Could not save resume state {}: {}", statePath, e.getMessage());
            return false;
        }
    }

    public synchronized void updateInputHash(Path baseDir, Collection<Path> inputFiles) throws IOException {
        inputHash = ContentHasher.hashFiles(baseDir, inputFiles);
    }

    public synchronized void updateConfigHash(String persona, Map<String, String> stack,
                                              Map<String, String> preferences) {
        configHash = ContentHasher.hashConfig(persona, stack, preferences);
    }

    /**
     * Records a freshly generated output against the current input and config hashes and
     * the dependencies' currently recorded output hashes.
     *
     * @throws IOException when the output file cannot be hashed
     */
    public synchronized void recordOutput(String taskName, Path outputPath, List<String> dependencies)
            throws IOException {
        String outputHash = ContentHasher.hashFile(outputPath);

        var depHashes = new HashMap<String, String>();
        for (String dep : dependencies) {
            TaskOutputRecord depRecord = taskOutputs.get(dep);
            if (depRecord != null) {
                depHashes.put(dep, depRecord.outputHash());
            }
        }

        taskOutputs.put(taskName, new TaskOutputRecord(
                outputPath.toString(), outputHash, inputHash, configHash, depHashes));
    }

    public synchronized RegenerationDecision shouldRegenerate(String taskName, Path outputPath,
                                                              List<String> dependencies) {
        TaskOutputRecord record = taskOutputs.get(taskName);
        OutputFingerprint fingerprint = record == null ? OutputFingerprint.missing() : OutputFingerprint.probe(outputPath);
        return RegenerationPolicy.evaluate(inputHash, configHash, record, fingerprint,
                dependencies, Map.copyOf(taskOutputs));
    }

    /**
     * Drops all in-memory state and deletes the state file.
     */
    public synchronized void clear() throws IOException {
        reset();
        Files.deleteIfExists(statePath);
    }

    public synchronized ResumeState state() {
        return new ResumeState(inputHash, configHash, taskOutputs);
    }

    private void reset() {
        inputHash = "";
        configHash = "";
        taskOutputs.clear();
    }
}
