package phonebook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the phonebook console application.
 *
 * <p>Runs without a web server; the interactive menu is provided by
 * {@link phonebook.console.ConsoleRunner} when {@code phonebook.console.enabled} is true.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PhonebookApplication {

    public static void main(final String[] args) {
        SpringApplication.run(PhonebookApplication.class, args);
    }
}
