package work.lcod.capsule.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.capsule.api.LogLevel;
import work.lcod.capsule.demo.DemoCapsule;
import work.lcod.capsule.protocol.MessageCodec;
import work.lcod.capsule.protocol.ProtocolMessage;
import work.lcod.capsule.support.CapturedOutput;

class CapsuleCommandTest {
    @TempDir
    Path tempDir;

    @Test
    void describePrintsTheDemoMetadata() throws Exception {
        var out = new StringWriter();
        var cli = Main.commandLine().setOut(new PrintWriter(out));

        int exit = cli.execute("describe", "demo");

        assertEquals(0, exit);
        var json = new ObjectMapper().readTree(out.toString());
        assertEquals("demo", json.path("name").asText());
        assertEquals("math", json.path("capabilities").path(0).path("name").asText());
        assertEquals("stream", json.path("capabilities").path(1).path("operations").path(0).path("kind").asText());
    }

    @Test
    void describeAcceptsAnExplicitProvider() throws Exception {
        var out = new StringWriter();
        var cli = Main.commandLine().setOut(new PrintWriter(out));

        int exit = cli.execute("describe", "whatever", "--provider", DemoCapsule.class.getName());

        assertEquals(0, exit);
        assertEquals("demo", new ObjectMapper().readTree(out.toString()).path("name").asText());
    }

    @Test
    void unknownCapsuleFailsWithAShortMessage() {
        var err = new StringWriter();
        var cli = Main.commandLine().setErr(new PrintWriter(err));

        int exit = cli.execute("describe", "nope");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Unknown capsule 'nope' (available: demo)"), err.toString());
    }

    @Test
    void versionNamesTheProtocol() {
        var out = new StringWriter();
        var cli = Main.commandLine().setOut(new PrintWriter(out));

        assertEquals(0, cli.execute("--version"));
        assertTrue(out.toString().contains("capsule (java)"), out.toString());
    }

    @Test
    void serveAnswersOnTheGivenStreams() throws Exception {
        var codec = new MessageCodec();
        var output = new CapturedOutput(codec);
        var serve = new ServeCommand();
        serve.input = new ByteArrayInputStream(
            "{\"type\":\"boot\",\"capsuleName\":\"demo\"}\n{\"type\":\"shutdown\"}\n".getBytes(StandardCharsets.UTF_8)
        );
        serve.output = output;

        int exit = new CommandLine(serve).execute("demo", "--log-level", "warn");

        assertEquals(0, exit);
        var booted = output.next(ProtocolMessage.StimulusEvent.class);
        assertEquals(Map.of("phase", "boot"), booted.stimulus().data());
        assertTrue(output.next(ProtocolMessage.BootResponse.class).ready());
        output.next(ProtocolMessage.StimulusEvent.class);
        assertTrue(output.next(ProtocolMessage.ShutdownResponse.class).ok());
        assertNull(output.poll(Duration.ofMillis(50)));
    }

    @Test
    void optionsOverrideTheConfigFile() throws Exception {
        var file = tempDir.resolve("capsule.toml");
        Files.writeString(file, "log_level = \"debug\"\n[runner]\ndrain_timeout = \"10s\"\n");
        var serve = new ServeCommand();

        new CommandLine(serve).parseArgs("demo", "--config", file.toString(), "--drain-timeout", "250ms");
        var config = serve.resolveConfig();

        assertEquals(Duration.ofMillis(250), config.drainTimeout());
        assertEquals(LogLevel.DEBUG, config.logLevel());
    }
}
