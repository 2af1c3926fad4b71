package work.lcod.capsule.api;

import java.util.List;
import work.lcod.capsule.remote.RemoteCapsule;
import work.lcod.capsule.runtime.CapsuleCore;
import work.lcod.capsule.runtime.CapsuleDefinition;
import work.lcod.capsule.transport.LoopbackLauncher;
import work.lcod.capsule.transport.ProcessLauncher;
import work.lcod.capsule.transport.SshConfig;
import work.lcod.capsule.transport.SshLauncher;
import work.lcod.capsule.transport.SubprocessLauncher;

/**
 * Entry points for obtaining a {@link Capsule}, local or behind a transport.
 */
public final class Capsules {
    private Capsules() {}

    public static Capsule local(CapsuleDefinition definition) {
        return new CapsuleCore(definition);
    }

    public static Capsule remote(ProcessLauncher launcher, String capsuleName) {
        return new RemoteCapsule(launcher, capsuleName);
    }

    public static Capsule remote(ProcessLauncher launcher, String capsuleName, CapsuleConfig config) {
        return new RemoteCapsule(launcher, capsuleName, config);
    }

    /**
     * @param command a command that starts a protocol runner on its stdin/stdout, e.g. {@code capsule serve NAME}
     */
    public static Capsule subprocess(List<String> command, String capsuleName) {
        return new RemoteCapsule(new SubprocessLauncher(command), capsuleName);
    }

    public static Capsule ssh(SshConfig ssh, String capsuleName) {
        return new RemoteCapsule(new SshLauncher(ssh, capsuleName), capsuleName);
    }

    /**
     * Serves {@code definition} from a runner thread in this JVM, over the full wire path.
     */
    public static Capsule loopback(CapsuleDefinition definition) {
        return new RemoteCapsule(new LoopbackLauncher(definition), definition.name());
    }
}
