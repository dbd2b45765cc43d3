package com.example.jestadapter.cli;

import com.example.jestadapter.TestSupport;
import com.example.jestadapter.config.AdapterConfig;
import com.example.jestadapter.model.LoadResult;
import com.example.jestadapter.model.RunSummary;
import com.example.jestadapter.model.TaskParameters;
import com.example.jestadapter.orchestrator.TestLoadOrchestrator;
import com.example.jestadapter.orchestrator.TestRunOrchestrator;
import com.example.jestadapter.report.ResultReporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AdapterCommandLineRunnerTest {

    @TempDir
    Path dir;

    private final TestLoadOrchestrator loadOrchestrator = mock(TestLoadOrchestrator.class);
    private final TestRunOrchestrator runOrchestrator = mock(TestRunOrchestrator.class);
    private final AdapterCommandLineRunner runner =
            new AdapterCommandLineRunner(loadOrchestrator, runOrchestrator, AdapterConfig.newObjectMapper());

    private Path paramFile() {
        return TestSupport.write(dir.resolve("params.json"), """
                {
                  "TestSelectors": ["tests/a.test.js?math adds", "tests/b.test.js"],
                  "ProjectPath": "/work/project",
                  "TaskId": "task-42",
                  "FileReportPath": "/work/reports"
                }
                """);
    }

    @Test
    void readsParameterFile() {
        TaskParameters parameters = runner.readParameters(paramFile());

        assertEquals(List.of("tests/a.test.js?math adds", "tests/b.test.js"), parameters.testSelectors());
        assertEquals("/work/project", parameters.projectPath());
        assertEquals("task-42", parameters.taskId());
        assertEquals("/work/reports", parameters.fileReportPath());
    }

    @Test
    void loadModeDelegatesToLoadOrchestrator() {
        when(loadOrchestrator.load(any(), any())).thenReturn(LoadResult.of(List.of()));

        runner.run(new DefaultApplicationArguments("load", paramFile().toString()));

        ArgumentCaptor<TaskParameters> captor = ArgumentCaptor.forClass(TaskParameters.class);
        verify(loadOrchestrator).load(captor.capture(), any(ResultReporter.class));
        assertEquals("task-42", captor.getValue().taskId());
        verifyNoInteractions(runOrchestrator);
    }

    @Test
    void runModeDelegatesToRunOrchestrator() {
        when(runOrchestrator.run(any(), any())).thenReturn(new RunSummary(2, 0, 2));

        runner.run(new DefaultApplicationArguments("run", paramFile().toString()));

        verify(runOrchestrator).run(any(TaskParameters.class), any(ResultReporter.class));
        verifyNoInteractions(loadOrchestrator);
    }

    @Test
    void failuresAreNotPropagated() {
        when(runOrchestrator.run(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments("run", paramFile().toString())));
        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments("load", dir.resolve("missing.json").toString())));
    }

    @Test
    void wrongArgumentsOnlyLogUsage() {
        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments()));
        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments("explode", "x.json")));
        verifyNoInteractions(loadOrchestrator, runOrchestrator);
    }
}
