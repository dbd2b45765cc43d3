package com.example.jestadapter.report;

import com.example.jestadapter.model.LoadResult;
import com.example.jestadapter.model.TestResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes result documents as JSON files into the task's report directory.
 * <ul>
 *   <li>load result: {@code result.json}</li>
 *   <li>test result: {@code <md5 of the test name>.json}; reporting the same test again overwrites it</li>
 * </ul>
 * Every document is wrapped with the task id.
 */
public class FileResultReporter implements ResultReporter {

    private static final Logger log = LoggerFactory.getLogger(FileResultReporter.class);

    static final String LOAD_RESULT_FILE = "result.json";

    private final String taskId;
    private final Path reportPath;
    private final ObjectMapper objectMapper;

    public FileResultReporter(String taskId, Path reportPath, ObjectMapper objectMapper) {
        this.taskId = taskId;
        this.reportPath = reportPath;
        this.objectMapper = objectMapper;
    }

    @Override
    public void reportLoadResult(LoadResult loadResult) {
        Path file = reportPath.resolve(LOAD_RESULT_FILE);
        write(file, loadResult);
        log.info("Load result reported: {} tests, {} errors -> {}",
                loadResult.tests().size(), loadResult.loadErrors().size(), file);
    }

    @Override
    public void reportTestResult(TestResult testResult) {
        String name = testResult.test().name();
        Path file = reportPath.resolve(DigestUtils.md5DigestAsHex(name.getBytes(StandardCharsets.UTF_8)) + ".json");
        write(file, testResult);
        log.info("Test result reported: {} [{}]", name, testResult.resultType());
    }

    private void write(Path file, Object document) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("TaskId", taskId);
        envelope.put("Data", document);
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), envelope);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write report " + file + ": " + e.getMessage(), e);
        }
    }
}
