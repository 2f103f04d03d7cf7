package fr.lapetina.multillm;

import fr.lapetina.multillm.domain.model.ConnectionState;
import fr.lapetina.multillm.domain.session.BroadcastResult;
import fr.lapetina.multillm.domain.session.ChatSession;
import fr.lapetina.multillm.domain.session.SessionOutcome;
import fr.lapetina.multillm.domain.session.TranscriptEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Console entry point: opens one session per configured model and broadcasts every typed line to all of them.
 *
 * <p>Commands: {@code /summary}, {@code /status}, {@code /metrics}, {@code /quit}.
 */
public class MultiLlmApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultiLlmApplication.class);

    private final OrchestratorFactory factory;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public MultiLlmApplication(OrchestratorFactory factory) {
        this.factory = factory;
    }

    public MultiLlmApplication(String configPath, String apiKeyOverride) {
        this(OrchestratorFactory.create(configPath, apiKeyOverride));
    }

    /**
     * Initializes every session when configured to, and prints what each session recorded.
     */
    public void start(PrintStream out) {
        log.info("Starting Multi LLM orchestrator with {} sessions", factory.getSessions().size());
        if (!factory.getConfig().getConnection().isAutoHandshakeOnStartup()) {
            return;
        }
        BroadcastResult result = factory.getOrchestrator()
                .initializeAll(factory.getSessions(), factory.getCredentials())
                .join();
        for (ChatSession session : factory.getSessions()) {
            for (TranscriptEntry entry : session.transcript()) {
                out.println(format(session, entry));
            }
        }
        log.info("Initialized {} sessions, {} succeeded", result.size(), result.succeeded().size());
    }

    /**
     * Reads commands and messages until end of input or {@code /quit}.
     */
    public void runConsole(BufferedReader in, PrintStream out) throws IOException {
        String line;
        while (shutdownLatch.getCount() > 0 && (line = in.readLine()) != null) {
            if (!handle(line.trim(), out)) {
                requestShutdown();
            }
        }
    }

    /**
     * Handles one console line.
     *
     * @return false when the console should stop
     */
    boolean handle(String line, PrintStream out) {
        switch (line) {
            case "" -> {
                return true;
            }
            case "/quit" -> {
                return false;
            }
            case "/summary" -> out.println(factory.getOrchestrator()
                    .summarizeAll(factory.getSessions(), factory.getCredentials(),
                            factory.getConfig().getSummary().getSystemPrompt())
                    .join());
            case "/status" -> printStatus(out);
            case "/metrics" -> out.println(factory.getMetricsRegistry().scrape());
            default -> {
                BroadcastResult result = factory.getOrchestrator()
                        .broadcast(factory.getSessions(), line, factory.getCredentials())
                        .join();
                for (SessionOutcome outcome : result.outcomes()) {
                    out.println(format(outcome));
                }
            }
        }
        return true;
    }

    private void printStatus(PrintStream out) {
        List<ConnectionState> states = factory.getConnectionRegistry().getAllStates();
        if (states.isEmpty()) {
            out.println("No connections yet.");
            return;
        }
        for (ConnectionState state : states) {
            out.println(state.provider() + ": " + (state.connected() ? "connected" : "disconnected")
                    + state.lastHandshake().map(time -> " (last handshake " + time + ")").orElse("")
                    + " - " + state.lastMessage());
        }
    }

    private static String format(ChatSession session, TranscriptEntry entry) {
        return "[" + session.displayName() + "] " + entry.role().wireName() + ": " + entry.content();
    }

    private static String format(SessionOutcome outcome) {
        String text = outcome.isSuccess() ? outcome.reply() : outcome.message();
        return "[" + outcome.sessionName() + "] " + text;
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public OrchestratorFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Multi LLM orchestrator...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Multi LLM orchestrator shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        String apiKeyOverride = args.length > 1 ? args[1] : null;

        try (MultiLlmApplication app = new MultiLlmApplication(configPath, apiKeyOverride)) {
            Runtime.getRuntime().addShutdownHook(new Thread(app::requestShutdown));

            app.start(System.out);
            app.runConsole(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);

        } catch (Exception e) {
            log.error("Failed to run Multi LLM orchestrator", e);
            System.exit(1);
        }
    }
}
