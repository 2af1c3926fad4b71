package work.lcod.capsule.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reaches a capsule on another host by running {@code CAPSULE serve NAME} through the local {@code ssh} client.
 * Authentication and encryption are left to ssh.
 */
public final class SshLauncher implements ProcessLauncher {
    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    private final SshConfig config;
    private final String capsuleName;
    private final SubprocessLauncher delegate;

    public SshLauncher(SshConfig config, String capsuleName) {
        this.config = config;
        this.capsuleName = capsuleName;
        this.delegate = new SubprocessLauncher(command());
    }

    /**
     * The local command line, e.g. {@code ssh -p 22 -T user@host 'cd /srv && capsule serve demo'}.
     */
    public List<String> command() {
        var command = new ArrayList<String>();
        command.add("ssh");
        command.add("-p");
        command.add(Integer.toString(config.port()));
        if (config.identityFile() != null) {
            command.add("-i");
            command.add(config.identityFile().toString());
        }
        if (config.connectTimeout() != null) {
            command.add("-o");
            command.add("ConnectTimeout=" + Math.max(1, config.connectTimeout().toSeconds()));
        }
        command.add("-T");
        command.add(config.user() + "@" + config.host());
        command.add(remoteCommand());
        return command;
    }

    public String remoteCommand() {
        var serve = quote(config.capsuleCommand()) + " serve " + quote(capsuleName);
        var dir = config.workingDirectory();
        if (dir == null || dir.isBlank()) {
            return serve;
        }
        return "cd " + quote(dir) + " && " + serve;
    }

    @Override
    public LaunchedProcess launch() {
        return delegate.launch();
    }

    static String quote(String value) {
        if (SHELL_SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
