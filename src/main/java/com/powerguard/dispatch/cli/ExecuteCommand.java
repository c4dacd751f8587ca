package com.powerguard.dispatch.cli;

import com.powerguard.core.engine.ExecutionCoordinator;
import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.dispatch.api.ActionableBatchReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: powerguard execute &lt;batch.json&gt;
 * <p>
 * Runs a batch file through the execution coordinator. Exit code 0 when every actionable
 * succeeded, 1 when at least one did not, 2 when the file could not be read.
 */
@Command(name = "execute", mixinStandardHelpOptions = true,
        description = "Execute a batch of actionables from a JSON file")
@Component
public class ExecuteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Batch file: a JSON array or an object with an 'actionables' array")
    private Path batchFile;

    private final ExecutionCoordinator coordinator;
    private final ActionableBatchReader batchReader;

    public ExecuteCommand(ExecutionCoordinator coordinator, ActionableBatchReader batchReader) {
        this.coordinator = coordinator;
        this.batchReader = batchReader;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ActionableRecord> records;
        try {
            records = batchReader.read(batchFile);
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Could not read " + batchFile + ": " + e.getMessage());
            return 2;
        }

        String batchId = coordinator.generateBatchId();
        ConsoleOutput.info("Batch " + batchId + ": " + records.size() + " actionable(s)");
        List<ExecutionResult> results = coordinator.executeBatch(batchId, records);

        results.forEach(ConsoleOutput::result);
        int succeeded = (int) results.stream().filter(ExecutionResult::isSuccess).count();
        ConsoleOutput.summary(results.size(), succeeded);
        return succeeded == results.size() ? 0 : 1;
    }
}
