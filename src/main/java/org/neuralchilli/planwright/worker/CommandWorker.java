package org.neuralchilli.planwright.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.neuralchilli.planwright.domain.ItemRef;
import org.neuralchilli.planwright.domain.WorkItem;
import org.neuralchilli.planwright.domain.WorkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a configured external command once per work item.
 *
 * The item is described to the command through environment variables.
 * Exit code 0 is success, the configured incomplete code means the item is
 * still in progress, anything else is a failure. If the last output line is a
 * JSON object it is returned as result data.
 *
 * Trial-run mode logs what would execute and reports success.
 */
public class CommandWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(CommandWorker.class);

    static final String ENV_PLAN = "PLANWRIGHT_PLAN";
    static final String ENV_ITEM = "PLANWRIGHT_ITEM";
    static final String ENV_REF = "PLANWRIGHT_ITEM_REF";
    static final String ENV_KIND = "PLANWRIGHT_ITEM_KIND";
    static final String ENV_PRIORITY = "PLANWRIGHT_PRIORITY";
    static final String ENV_DELIVERABLE = "PLANWRIGHT_DELIVERABLE";

    private static final long OUTPUT_GRACE_MILLIS = 2_000;

    private final List<String> command;
    private final boolean trialRun;
    private final Duration timeout;
    private final int incompleteExitCode;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CommandWorker(List<String> command, boolean trialRun, Duration timeout, int incompleteExitCode) {
        this.command = command != null ? List.copyOf(command) : List.of();
        this.trialRun = trialRun;
        this.timeout = timeout;
        this.incompleteExitCode = incompleteExitCode;
    }

    @Override
    public WorkResult execute(WorkItem item, ItemRef ref) {
        Map<String, String> env = environment(item, ref);

        if (trialRun) {
            return executeTrialRun(env, ref);
        }
        if (command.isEmpty()) {
            return WorkResult.failure("No worker command configured");
        }
        return executeCommand(env, ref);
    }

    static Map<String, String> environment(WorkItem item, ItemRef ref) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_PLAN, ref.planId());
        env.put(ENV_ITEM, ref.itemId());
        env.put(ENV_REF, ref.toString());
        env.put(ENV_KIND, item.kind().name());
        env.put(ENV_PRIORITY, item.priority().name());
        if (item.hasDeliverable()) {
            env.put(ENV_DELIVERABLE, item.deliverable());
        }
        return env;
    }

    private WorkResult executeTrialRun(Map<String, String> env, ItemRef ref) {
        String commandStr = String.join(" ", command);

        log.info("TRIAL RUN - would execute {}", ref);
        log.info("  Command: {}", commandStr.isEmpty() ? "(none configured)" : commandStr);
        env.forEach((k, v) -> log.info("    {}={}", k, v));

        return WorkResult.success(Map.of(
                "trial_run", true,
                "command", commandStr
        ));
    }

    private WorkResult executeCommand(Map<String, String> env, ItemRef ref) {
        log.debug("Executing for {}: {}", ref, String.join(" ", command));

        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.environment().putAll(env);
            pb.redirectErrorStream(true);

            Process process = pb.start();

            // Drain output concurrently with waitFor
            StringBuffer output = new StringBuffer();
            Thread drain = new Thread(() -> drainOutput(process, output, ref), "worker-output-" + ref);
            drain.setDaemon(true);
            drain.start();

            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                drain.join(OUTPUT_GRACE_MILLIS);
                log.warn("Worker for {} timed out after {}ms", ref, timeout.toMillis());
                return WorkResult.failure("Worker timed out after " + timeout.toMillis() + "ms\n"
                        + output.toString().trim());
            }
            drain.join(OUTPUT_GRACE_MILLIS);

            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return WorkResult.success(tryParseJsonOutput(output.toString()));
            }
            if (exitCode == incompleteExitCode) {
                return WorkResult.incomplete("Worker reported item incomplete\n" + output.toString().trim());
            }
            return WorkResult.failure("Worker exited with code " + exitCode + "\n" + output.toString().trim());

        } catch (IOException e) {
            return WorkResult.failure("Failed to start worker process: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkResult.failure("Worker interrupted");
        }
    }

    private static void drainOutput(Process process, StringBuffer output, ItemRef ref) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
                log.debug("[{}] {}", ref, line);
            }
        } catch (IOException e) {
            log.debug("[{}] output closed: {}", ref, e.getMessage());
        }
    }

    /**
     * Last output line as a JSON object if it is one, otherwise the whole output.
     */
    private Map<String, Object> tryParseJsonOutput(String output) {
        String[] lines = output.trim().split("\n");
        String lastLine = lines[lines.length - 1].trim();

        if (lastLine.startsWith("{") && lastLine.endsWith("}")) {
            try {
                Map<String, Object> parsed = objectMapper.readValue(lastLine, new TypeReference<Map<String, Object>>() {});
                parsed.values().removeIf(Objects::isNull);
                return parsed;
            } catch (JsonProcessingException e) {
                log.trace("Last line is not valid JSON: {}", e.getMessage());
            }
        }
        return Map.of("output", output.trim());
    }
}
