package work.lcod.capsule.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "capsule",
    description = "Host capsules behind the line-delimited JSON protocol.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { ServeCommand.class, DescribeCommand.class }
)
final class CapsuleCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getErr());
    }
}
