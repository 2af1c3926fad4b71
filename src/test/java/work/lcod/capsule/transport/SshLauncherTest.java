package work.lcod.capsule.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SshLauncherTest {
    @Test
    void buildsAMinimalCommand() {
        var launcher = new SshLauncher(SshConfig.of("deploy", "build-01"), "demo");

        assertEquals(List.of("ssh", "-p", "22", "-T", "deploy@build-01", "capsule serve demo"), launcher.command());
    }

    @Test
    void addsKeyTimeoutAndWorkingDirectory() {
        var config = SshConfig.of("deploy", "build-01")
            .withPort(2222)
            .withIdentityFile(Path.of("/home/deploy/.ssh/id_ed25519"))
            .withConnectTimeout(Duration.ofMillis(2500))
            .withWorkingDirectory("/srv/capsules")
            .withCapsuleCommand("/opt/capsule/bin/capsule");

        var launcher = new SshLauncher(config, "demo");

        assertEquals(List.of(
            "ssh", "-p", "2222",
            "-i", "/home/deploy/.ssh/id_ed25519",
            "-o", "ConnectTimeout=2",
            "-T", "deploy@build-01",
            "cd /srv/capsules && /opt/capsule/bin/capsule serve demo"
        ), launcher.command());
    }

    @Test
    void quotesArgumentsTheRemoteShellWouldSplit() {
        var config = SshConfig.of("deploy", "build-01").withWorkingDirectory("/srv/my capsules");

        var launcher = new SshLauncher(config, "it's");

        assertEquals("cd '/srv/my capsules' && capsule serve 'it'\\''s'", launcher.remoteCommand());
    }

    @Test
    void validatesTheTarget() {
        assertThrows(IllegalArgumentException.class, () -> SshConfig.of("", "host"));
        assertThrows(IllegalArgumentException.class, () -> SshConfig.of("user", "host").withPort(70000));
    }
}
