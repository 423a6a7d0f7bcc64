package fun.ai.devhub;

import fun.ai.devhub.config.DevHubProperties;
import fun.ai.devhub.process.ServiceProcessManager;
import fun.ai.devhub.process.ShellCommandBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "devhub.services.shell=/bin/bash")
class DevHubApplicationTest {

    @Autowired
    private ShellCommandBuilder shellCommandBuilder;

    @Autowired
    private ServiceProcessManager processManager;

    @Autowired
    private DevHubProperties props;

    @Test
    void testContextWiresShellBuilderFromProperties() {
        assertNotNull(processManager);
        assertEquals("/bin/bash", props.getServices().getShell());
        assertEquals(List.of("/bin/bash", "-c", "npm run dev"), shellCommandBuilder.build("npm run dev"));
    }
}
