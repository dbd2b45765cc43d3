package com.example.jestadapter.service;

import com.example.jestadapter.model.LogLevel;
import com.example.jestadapter.model.ResultType;
import com.example.jestadapter.model.RunRecord;
import com.example.jestadapter.model.TestCase;
import com.example.jestadapter.model.TestCaseLog;
import com.example.jestadapter.model.TestCaseStep;
import com.example.jestadapter.model.TestResult;
import com.example.jestadapter.model.TestSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Converts parsed run records into the result documents expected by the reporting side.
 * Pure transform: one result per record, each with a single step holding a single log entry.
 */
@Service
public class ResultNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);

    /** ISO-8601 in UTC with millisecond precision, e.g. {@code 2021-01-07T06:13:20.000Z}. */
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    static final String STEP_TITLE = "Jest execution";

    public List<TestResult> normalize(Map<String, RunRecord> records) {
        List<TestResult> results = records.values().stream()
                .map(this::normalize)
                .toList();
        log.info("ResultNormalizer: {} results normalized ({} failed)", results.size(),
                results.stream().filter(r -> r.resultType() == ResultType.FAILURE).count());
        return results;
    }

    public TestResult normalize(RunRecord record) {
        ResultType resultType = ResultType.of(record.status());
        String startTime = formatEpochMillis(record.startTime());
        String endTime = formatEpochMillis(record.endTime());

        TestCaseLog stepLog = new TestCaseLog(
                startTime,
                resultType == ResultType.SUCCESS ? LogLevel.INFO : LogLevel.ERROR,
                record.content(),
                List.of());
        TestCaseStep step = new TestCaseStep(startTime, endTime, STEP_TITLE, resultType, List.of(stepLog));

        return new TestResult(
                new TestCase(TestSelector.encodeUri(record.selector())),
                startTime,
                endTime,
                resultType,
                record.message(),
                List.of(step));
    }

    static String formatEpochMillis(long epochMillis) {
        return TIMESTAMP.format(Instant.ofEpochMilli(epochMillis));
    }
}
