package fun.ai.devhub.process;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShellCommandBuilderTest {

    @Test
    void testUnixDefaultShell() {
        ShellCommandBuilder builder = new ShellCommandBuilder(null, false);
        assertEquals(List.of("/bin/sh", "-c", "npm run dev"), builder.build("npm run dev"));
    }

    @Test
    void testOnlyOuterWhitespaceTrimmed() {
        ShellCommandBuilder builder = new ShellCommandBuilder(null, false);
        assertEquals(List.of("/bin/sh", "-c", "echo hi && sleep 2"), builder.build("  echo hi && sleep 2 \n"));
    }

    @Test
    void testQuotedWhitespaceKept() {
        ShellCommandBuilder builder = new ShellCommandBuilder(null, false);
        assertEquals(List.of("/bin/sh", "-c", "echo \"a  b\""), builder.build(" echo \"a  b\" "));
    }

    @Test
    void testWindowsUsesCmd() {
        ShellCommandBuilder builder = new ShellCommandBuilder(null, true);
        assertEquals(List.of("cmd.exe", "/d", "/s", "/c", "npm start"), builder.build("npm start"));
    }

    @Test
    void testConfiguredShell() {
        ShellCommandBuilder builder = new ShellCommandBuilder("/bin/bash", false);
        assertEquals(List.of("/bin/bash", "-c", "yarn dev | tee out.log"), builder.build("yarn dev | tee out.log"));
    }

    @Test
    void testEmptyCommand() {
        ShellCommandBuilder builder = new ShellCommandBuilder(null, false);
        assertThrows(IllegalArgumentException.class, () -> builder.build(null));
        assertThrows(IllegalArgumentException.class, () -> builder.build("   "));
    }
}
