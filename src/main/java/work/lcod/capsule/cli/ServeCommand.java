package work.lcod.capsule.cli;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.capsule.api.CapsuleConfig;
import work.lcod.capsule.api.LogLevel;
import work.lcod.capsule.config.CapsuleConfigLoader;
import work.lcod.capsule.protocol.MessageCodec;
import work.lcod.capsule.protocol.MessageWriter;
import work.lcod.capsule.protocol.ProtocolRunner;
import work.lcod.capsule.shared.DurationParser;

@CommandLine.Command(
    name = "serve",
    description = "Serve a capsule over stdin/stdout until shutdown or end of input.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class ServeCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServeCommand.class);

    @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Name of the capsule to serve.")
    private String name;

    @CommandLine.Option(names = "--config", paramLabel = "FILE", description = "TOML configuration file.")
    private Path configFile;

    @CommandLine.Option(names = "--log-level", paramLabel = "LEVEL", description = "trace, debug, info, warn, error or off.")
    private String logLevel;

    @CommandLine.Option(names = "--drain-timeout", paramLabel = "DURATION",
        description = "How long to wait for running triggers after shutdown (e.g. 5s).")
    private String drainTimeout;

    @CommandLine.Option(names = "--provider", paramLabel = "CLASS",
        description = "CapsuleProvider implementation to use instead of the service-loaded one.")
    private String providerClass;

    InputStream input = System.in;
    OutputStream output;

    @Override
    public Integer call() {
        var config = resolveConfig();
        LoggingSetup.apply(config.logLevel());
        var definition = CapsuleProviders.resolve(name, providerClass).definition();

        var protocolOut = output;
        if (protocolOut == null) {
            // stdout carries the protocol; stray prints go to stderr
            protocolOut = System.out;
            System.setOut(new PrintStream(System.err, true));
        }
        var codec = new MessageCodec();
        var writer = new MessageWriter(protocolOut, codec);
        LOGGER.info("Serving capsule '{}'", definition.name());
        try {
            new ProtocolRunner(definition, writer, config.drainTimeout()).serve(input, codec);
        } finally {
            writer.close();
        }
        LOGGER.info("Capsule '{}' stopped", definition.name());
        return 0;
    }

    CapsuleConfig resolveConfig() {
        var config = configFile != null ? CapsuleConfigLoader.load(configFile) : CapsuleConfig.defaults();
        var builder = config.toBuilder();
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        if (drainTimeout != null) {
            DurationParser.parse(drainTimeout, "--drain-timeout").ifPresent(builder::drainTimeout);
        }
        return builder.build();
    }
}
