package dev.tana.edge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tana.edge.api.EdgeRunner;
import dev.tana.edge.api.HttpMethod;
import dev.tana.edge.api.InvocationRequest;
import dev.tana.edge.api.InvocationResult;
import dev.tana.edge.capability.ConsoleSink;
import java.io.IOException;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "invoke",
    description = "Invoke one contract and print the result as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class InvokeCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ConfigOptions options = new ConfigOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "CONTRACT_ID", description = "Directory name under the contracts root.")
    String contractId;

    @CommandLine.Option(names = {"-X", "--method"}, description = "GET or POST.", defaultValue = "GET")
    String method;

    @CommandLine.Option(names = {"-d", "--body"}, description = "JSON body passed to Post.")
    String body;

    @CommandLine.Option(names = "--path", description = "Request path seen by the contract.", defaultValue = "/")
    String path;

    @Override
    public Integer call() throws Exception {
        HttpMethod httpMethod;
        try {
            httpMethod = HttpMethod.from(method);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
        InvocationRequest.Builder request = InvocationRequest.builder(contractId)
            .method(httpMethod)
            .path(path);
        if (body != null) {
            request.body(parseBody());
        }

        try (EdgeRunner runner = new EdgeRunner(options.builder().build(), ConsoleSink.streams(System.err, System.err))) {
            InvocationResult result = runner.invoke(request.build());
            spec.commandLine().getOut().println(result.toPrettyJson());
            spec.commandLine().getOut().flush();
            return result.isError() ? 1 : 0;
        }
    }

    private JsonNode parseBody() {
        try {
            return JSON.readTree(body);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON body: " + ex.getMessage());
        }
    }
}
