package phonebook.console;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import phonebook.config.PhonebookProperties;
import phonebook.service.PhonebookService;

/**
 * Starts an interactive {@link ConsoleSession} on standard input and output.
 *
 * <p>Disabled with {@code phonebook.console.enabled=false}, e.g. in tests. A backing file that
 * cannot be loaded aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "phonebook.console", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleRunner implements CommandLineRunner {

    private final PhonebookService service;
    private final CommandDispatcher dispatcher;
    private final PhonebookProperties properties;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singletons injected by the container")
    public ConsoleRunner(
            final PhonebookService service,
            final CommandDispatcher dispatcher,
            final PhonebookProperties properties) {
        this.service = service;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @Override
    public void run(final String... args) {
        service.open();
        final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        final PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        new ConsoleSession(dispatcher, properties.defaultPageSize(), in, out).run();
    }
}
