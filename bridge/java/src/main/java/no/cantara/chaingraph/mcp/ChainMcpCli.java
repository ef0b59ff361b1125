package no.cantara.chaingraph.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for chain-mcp.
 *
 * <pre>
 * Usage: chain-mcp [architecture.chain] [--no-warnings] [--include-deprecated]
 * </pre>
 */
public class ChainMcpCli {

    static final String DEFAULT_DOCUMENT = "architecture.chain";

    public static void main(String[] args) {
        Path    document          = Path.of(DEFAULT_DOCUMENT);
        boolean includeDeprecated = false;
        boolean warnOnValidation  = true;

        for (String arg : args) {
            switch (arg) {
                case "--include-deprecated" -> includeDeprecated = true;
                case "--no-warnings"        -> warnOnValidation  = false;
                default -> {
                    if (!arg.startsWith("-")) {
                        document = Path.of(arg);
                    }
                }
            }
        }

        if (!document.toFile().exists()) {
            System.err.println("[chain-mcp] Error: chain document not found at " + document);
            System.exit(1);
        }

        StdioServerTransportProvider transport = new StdioServerTransportProvider(new ObjectMapper());

        McpSyncServer server;
        try {
            server = ChainServer.createServer(document, transport, includeDeprecated, warnOnValidation);
        } catch (Exception e) {
            System.err.println("[chain-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // The transport handles I/O on its own threads; exit when the client disconnects.
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
