package com.cypher.bridge.bulk;

import com.cypher.bridge.api.ExecutionCoordinator;
import com.cypher.bridge.api.ExecutionOptions;
import com.cypher.bridge.core.model.Outcome;
import com.cypher.bridge.logging.LogContext;
import com.cypher.bridge.query.StatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes Cypher statement files, statement by statement.
 *
 * <p>Unlike a batch, a failing statement does not stop the load: the error is
 * recorded and the next statement runs. An unreadable file is recorded and the
 * next file is loaded.</p>
 */
public class CypherFileLoader {
    private static final Logger log = LoggerFactory.getLogger(CypherFileLoader.class);

    private final ExecutionCoordinator coordinator;
    private final ExecutionOptions options;

    public CypherFileLoader(ExecutionCoordinator coordinator) {
        this(coordinator, null);
    }

    public CypherFileLoader(ExecutionCoordinator coordinator, ExecutionOptions options) {
        this.coordinator = coordinator;
        this.options = options != null ? options : coordinator.getDefaultOptions();
    }

    /**
     * Loads each file in order as UTF-8 text.
     */
    public FileLoadResult loadFiles(List<Path> files, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Tally tally = new Tally();
        for (Path file : files) {
            String source = file.toString();
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException | FileNotFoundException e) {
                tally.sourceFailed(source, "File '" + source + "' not found");
                continue;
            } catch (IOException e) {
                tally.sourceFailed(source, "Error reading file '" + source + "': " + e.getMessage());
                continue;
            }
            run(source, content, tally, cb);
        }
        FileLoadResult result = tally.toResult();
        log.info("load.completed result={}", result);
        return result;
    }

    /**
     * Loads statements from {@code reader}; {@code source} labels errors and log lines.
     */
    public FileLoadResult loadReader(String source, Reader reader) {
        Tally tally = new Tally();
        StringWriter content = new StringWriter();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            br.transferTo(content);
            run(source, content.toString(), tally, ProgressCallback.NOOP);
        } catch (IOException e) {
            tally.sourceFailed(source, "Error reading file '" + source + "': " + e.getMessage());
        }
        FileLoadResult result = tally.toResult();
        log.info("load.completed result={}", result);
        return result;
    }

    private void run(String source, String content, Tally tally, ProgressCallback cb) {
        tally.filesProcessed++;
        List<String> statements = StatementSplitter.split(content);
        try (LogContext ignored = LogContext.forFile(source)) {
            log.info("load.file source={} statements={}", source, statements.size());
            for (int i = 0; i < statements.size(); i++) {
                String statement = statements.get(i);
                Outcome outcome = coordinator.executeStatement(statement, options);
                tally.statementsExecuted++;
                if (outcome.isFailure()) {
                    tally.statementsFailed++;
                    tally.errors.add(new FileLoadResult.LoadError(source, i + 1, statement, outcome.message()));
                    log.warn("load.error source={} statement={} error={}", source, i + 1, outcome.message());
                } else {
                    tally.rowsReturned += outcome.rowCount();
                }
                cb.onProgress(i + 1, statements.size(), source + ": statement " + (i + 1));
            }
        }
    }

    private static final class Tally {
        int filesProcessed;
        int statementsExecuted;
        int statementsFailed;
        long rowsReturned;
        final List<FileLoadResult.LoadError> errors = new ArrayList<>();

        void sourceFailed(String source, String message) {
            errors.add(new FileLoadResult.LoadError(source, 0, null, message));
            log.warn("load.failed source={} error={}", source, message);
        }

        FileLoadResult toResult() {
            return new FileLoadResult(filesProcessed, statementsExecuted, statementsFailed, rowsReturned, errors);
        }
    }
}
