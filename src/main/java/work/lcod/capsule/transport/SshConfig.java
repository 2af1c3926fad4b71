package work.lcod.capsule.transport;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Where and how to reach a capsule over ssh.
 *
 * @param identityFile     optional private key passed with {@code -i}
 * @param workingDirectory optional remote directory the capsule command runs in
 * @param capsuleCommand   remote executable that understands {@code serve NAME}
 * @param connectTimeout   optional, passed as {@code -o ConnectTimeout}
 */
public record SshConfig(
    String host,
    int port,
    String user,
    Path identityFile,
    String workingDirectory,
    String capsuleCommand,
    Duration connectTimeout
) {
    public static final int DEFAULT_PORT = 22;
    public static final String DEFAULT_CAPSULE_COMMAND = "capsule";

    public SshConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(user, "user");
        if (host.isBlank() || user.isBlank()) {
            throw new IllegalArgumentException("ssh host and user must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid ssh port: " + port);
        }
        if (capsuleCommand == null || capsuleCommand.isBlank()) {
            capsuleCommand = DEFAULT_CAPSULE_COMMAND;
        }
    }

    public static SshConfig of(String user, String host) {
        return new SshConfig(host, DEFAULT_PORT, user, null, null, null, null);
    }

    public SshConfig withPort(int newPort) {
        return new SshConfig(host, newPort, user, identityFile, workingDirectory, capsuleCommand, connectTimeout);
    }

    public SshConfig withIdentityFile(Path newIdentityFile) {
        return new SshConfig(host, port, user, newIdentityFile, workingDirectory, capsuleCommand, connectTimeout);
    }

    public SshConfig withWorkingDirectory(String newWorkingDirectory) {
        return new SshConfig(host, port, user, identityFile, newWorkingDirectory, capsuleCommand, connectTimeout);
    }

    public SshConfig withCapsuleCommand(String newCapsuleCommand) {
        return new SshConfig(host, port, user, identityFile, workingDirectory, newCapsuleCommand, connectTimeout);
    }

    public SshConfig withConnectTimeout(Duration newConnectTimeout) {
        return new SshConfig(host, port, user, identityFile, workingDirectory, capsuleCommand, newConnectTimeout);
    }
}
