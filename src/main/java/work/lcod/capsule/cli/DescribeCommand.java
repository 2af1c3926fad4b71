package work.lcod.capsule.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.capsule.runtime.CapsuleCore;

@CommandLine.Command(
    name = "describe",
    description = "Print the metadata of a capsule as JSON.",
    mixinStandardHelpOptions = true
)
final class DescribeCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Name of the capsule to describe.")
    private String name;

    @CommandLine.Option(names = "--provider", paramLabel = "CLASS",
        description = "CapsuleProvider implementation to use instead of the service-loaded one.")
    private String providerClass;

    @Override
    public Integer call() throws Exception {
        var capsule = new CapsuleCore(CapsuleProviders.resolve(name, providerClass).definition());
        spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(capsule.describe()));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
