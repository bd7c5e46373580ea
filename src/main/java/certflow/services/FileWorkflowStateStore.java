package certflow.services;

import certflow.config.AppProperties;
import certflow.model.WorkflowState;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Keeps one JSON file per workflow. Files are replaced atomically so that a crash leaves either the previous or the
 * next checkpoint, never a torn one.
 */
@Service
@Slf4j
public class FileWorkflowStateStore implements WorkflowStateStore {

    private static final Pattern SAFE_ID = Pattern.compile("[a-z0-9][a-z0-9._-]*");

    private final ObjectMapper objectMapper;
    private final Path directory;

    public FileWorkflowStateStore(ObjectMapper objectMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper;
        this.directory = appProperties.workflow().stateDirectory();
    }

    @Override
    public Mono<WorkflowState> load(String workflowId) {
        return Mono.fromCallable(() -> {
                final Path file = fileFor(workflowId);
                if (!Files.exists(file)) {
                    return null;
                }
                return objectMapper.readValue(file.toFile(), WorkflowState.class);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<WorkflowState> save(WorkflowState state) {
        return Mono.fromCallable(() -> {
                final Path file = fileFor(state.workflowId());
                Files.createDirectories(directory);
                final Path temp = Files.createTempFile(directory, state.workflowId(), ".tmp");
                try {
                    objectMapper.writeValue(temp.toFile(), state);
                    Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    Files.deleteIfExists(temp);
                    throw e;
                }
                log.trace("Saved workflow={} at stage={}", state.workflowId(), state.stage());
                return state;
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Path fileFor(String workflowId) {
        if (!SAFE_ID.matcher(workflowId).matches()) {
            throw new IllegalArgumentException("Not a workflow id: " + workflowId);
        }
        return directory.resolve(workflowId + ".json");
    }
}
