package phonebook.console;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import phonebook.config.CsvMapperConfig;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactUpdate;
import phonebook.domain.error.EmptyFieldError;
import phonebook.domain.error.EmptyQueryError;
import phonebook.domain.error.IndexOutOfRangeError;
import phonebook.persistence.CsvRecordStore;
import phonebook.persistence.PhonebookFile;
import phonebook.service.Paginator;
import phonebook.service.PhonebookService;
import phonebook.service.SearchEngine;
import phonebook.support.TestContacts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs commands end to end against a store backed by a temporary file.
 */
class CommandDispatcherTest {

    @TempDir
    Path dir;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        final CsvRecordStore store = new CsvRecordStore(
                new PhonebookFile(new CsvMapperConfig().csvMapper()), dir.resolve("phonebook.csv"));
        final PhonebookService service = new PhonebookService(store, new Paginator(), new SearchEngine());
        service.open();
        dispatcher = new CommandDispatcher(service);
    }

    private void addAll(final String... lastNames) {
        for (final String lastName : lastNames) {
            dispatcher.dispatch(new DirectoryCommand.AddContact(TestContacts.draft(lastName)));
        }
    }

    @Test
    void addReturnsEntryWithNextId() {
        addAll("Иванов", "Петров");

        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.AddContact(TestContacts.draft("Сидоров")));

        assertThat(result).isInstanceOf(CommandResult.ContactAdded.class);
        assertThat(((CommandResult.ContactAdded) result).entry().id()).isEqualTo(3);
    }

    @Test
    void invalidAddIsRejected() {
        final ContactDraft draft = new ContactDraft("", "Иван", "Иванович", "Org",
                TestContacts.WORK_PHONE, TestContacts.PERSONAL_PHONE);

        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.AddContact(draft));

        assertThat(result).isEqualTo(new CommandResult.Rejected(new EmptyFieldError("Фамилия")));
    }

    @Test
    void listPageReportsPageAndPageCount() {
        addAll("А", "Б", "В", "Г", "Д");

        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.ListPage(3, 2));

        assertThat(result).isInstanceOf(CommandResult.PageShown.class);
        final CommandResult.PageShown page = (CommandResult.PageShown) result;
        assertThat(page.entries()).extracting(e -> e.record().getLastName()).containsExactly("Д");
        assertThat(page.pageNumber()).isEqualTo(3);
        assertThat(page.pageCount()).isEqualTo(3);
    }

    @Test
    void showContactRejectsUnknownIndex() {
        addAll("Иванов");

        assertThat(dispatcher.dispatch(new DirectoryCommand.ShowContact(1)))
                .isInstanceOf(CommandResult.ContactShown.class);
        assertThat(dispatcher.dispatch(new DirectoryCommand.ShowContact(2)))
                .isEqualTo(new CommandResult.Rejected(new IndexOutOfRangeError(2, 1)));
    }

    @Test
    void editReturnsEditedEntry() {
        addAll("Иванов", "Петров");

        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.EditContact(
                1, ContactUpdate.builder().organization("Ivanov LLC").build()));

        assertThat(result).isInstanceOf(CommandResult.ContactEdited.class);
        final CommandResult.ContactEdited edited = (CommandResult.ContactEdited) result;
        assertThat(edited.entry().id()).isEqualTo(1);
        assertThat(edited.entry().record().getOrganization()).isEqualTo("Ivanov LLC");
    }

    @Test
    void editOutOfRangeIsRejected() {
        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.EditContact(
                1, ContactUpdate.builder().organization("Ivanov LLC").build()));

        assertThat(result).isEqualTo(new CommandResult.Rejected(new IndexOutOfRangeError(1, 0)));
    }

    @Test
    void searchFindsAndRejectsBlankTerm() {
        addAll("Иванов", "Петров");
        dispatcher.dispatch(new DirectoryCommand.EditContact(
                2, ContactUpdate.builder().organization("Ivanov LLC").build()));

        final CommandResult found = dispatcher.dispatch(new DirectoryCommand.Search("IVANOV"));
        final CommandResult blank = dispatcher.dispatch(new DirectoryCommand.Search(""));

        assertThat(found).isInstanceOf(CommandResult.SearchCompleted.class);
        assertThat(((CommandResult.SearchCompleted) found).matches())
                .extracting(e -> e.record().getLastName())
                .containsExactly("Петров");
        assertThat(blank).isEqualTo(new CommandResult.Rejected(new EmptyQueryError()));
    }

    @Test
    void nullCommandIsAProgrammingError() {
        assertThatThrownBy(() -> dispatcher.dispatch(null)).isInstanceOf(NullPointerException.class);
    }
}
