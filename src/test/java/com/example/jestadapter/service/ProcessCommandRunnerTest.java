package com.example.jestadapter.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void capturesOutputAndExitCode(@TempDir Path dir) {
        CommandRunner.CommandResult result = runner.run("echo hello; echo oops >&2; exit 3", dir);

        assertEquals(3, result.exitCode());
        assertFalse(result.succeeded());
        assertEquals("hello", result.stdout().strip());
        assertEquals("oops", result.stderr().strip());
    }

    @Test
    void runsInWorkingDirectory(@TempDir Path dir) {
        CommandRunner.CommandResult result = runner.run("echo '{}' > out.json", dir);

        assertTrue(result.succeeded());
        assertTrue(Files.exists(dir.resolve("out.json")));
    }

    @Test
    void processIsDestroyedWhenOutputCannotBeRead() {
        Process process = mock(Process.class);
        when(process.getErrorStream()).thenReturn(new ByteArrayInputStream(new byte[0]));
        when(process.getInputStream()).thenReturn(new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        });

        assertThrows(UncheckedIOException.class, () -> runner.await(process, "npx jest"));
        verify(process).destroy();
    }
}
