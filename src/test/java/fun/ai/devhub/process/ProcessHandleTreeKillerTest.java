package fun.ai.devhub.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessHandleTreeKillerTest {

    private final ProcessHandleTreeKiller killer = new ProcessHandleTreeKiller();

    @Test
    void testTerminatesWholeTree() throws Exception {
        Process p = new ProcessBuilder("/bin/sh", "-c", "sleep 30 & sleep 30 & wait").start();
        List<ProcessHandle> children = awaitDescendants(p, 2);

        assertTrue(killer.terminateProcessTree(p.pid(), KillSignal.TERM));

        assertTrue(p.waitFor(5, TimeUnit.SECONDS));
        for (ProcessHandle child : children) {
            assertFalse(child.onExit().get(5, TimeUnit.SECONDS).isAlive());
        }
    }

    @Test
    void testForcedKill() throws Exception {
        Process p = new ProcessBuilder("/bin/sh", "-c", "trap '' TERM; sleep 30").start();
        // 等 trap 生效
        Thread.sleep(300);

        killer.terminateProcessTree(p.pid(), KillSignal.TERM);
        assertFalse(p.waitFor(500, TimeUnit.MILLISECONDS));

        killer.terminateProcessTree(p.pid(), KillSignal.KILL);
        assertTrue(p.waitFor(5, TimeUnit.SECONDS));
    }

    @Test
    void testDeadProcess() throws Exception {
        Process p = new ProcessBuilder("/bin/sh", "-c", "exit 0").start();
        assertTrue(p.waitFor(5, TimeUnit.SECONDS));

        assertFalse(killer.terminateProcessTree(p.pid(), KillSignal.TERM));
    }

    private static List<ProcessHandle> awaitDescendants(Process p, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        List<ProcessHandle> found = List.of();
        while (System.currentTimeMillis() < deadline) {
            found = p.toHandle().descendants().collect(Collectors.toList());
            if (found.size() >= expected) {
                return found;
            }
            Thread.sleep(50);
        }
        fail("descendants not started: expected=" + expected + ", found=" + found.size());
        return found;
    }
}
