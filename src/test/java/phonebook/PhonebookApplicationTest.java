package phonebook;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import phonebook.config.PhonebookProperties;
import phonebook.console.ConsoleRunner;
import phonebook.persistence.CsvRecordStore;
import phonebook.service.PhonebookService;
import phonebook.support.TestContacts;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application context with the console disabled and a phonebook file in a temporary directory.
 */
@SpringBootTest
class PhonebookApplicationTest {

    @TempDir
    static Path dir;

    @DynamicPropertySource
    static void phonebookFile(final DynamicPropertyRegistry registry) {
        registry.add("phonebook.file", () -> dir.resolve("phonebook.csv").toString());
        registry.add("phonebook.default-page-size", () -> "5");
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PhonebookProperties properties;

    @Autowired
    private CsvRecordStore store;

    @Autowired
    private PhonebookService service;

    @Test
    void bindsPropertiesAndSkipsConsoleRunner() {
        assertThat(properties.defaultPageSize()).isEqualTo(5);
        assertThat(properties.console().enabled()).isFalse();
        assertThat(store.getPath()).isEqualTo(dir.resolve("phonebook.csv"));
        assertThat(context.getBeansOfType(ConsoleRunner.class)).isEmpty();
    }

    @Test
    void wiredServiceAddsAndPersists() {
        service.open();

        service.add(TestContacts.draft("Иванов"));

        assertThat(dir.resolve("phonebook.csv")).exists();
        assertThat(service.page(1, properties.defaultPageSize()))
                .extracting(entry -> entry.record().getLastName())
                .contains("Иванов");
    }
}
