package phonebook.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import phonebook.config.CsvMapperConfig;
import phonebook.persistence.CsvRecordStore;
import phonebook.persistence.PhonebookFile;
import phonebook.persistence.PhonebookPersistenceException;
import phonebook.service.Paginator;
import phonebook.service.PhonebookService;
import phonebook.service.SearchEngine;
import phonebook.support.TestContacts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Drives {@link ConsoleSession} with scripted input and checks what the user would see.
 */
class ConsoleSessionTest {

    @TempDir
    Path dir;

    private PhonebookService service;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        final CsvRecordStore store = new CsvRecordStore(
                new PhonebookFile(new CsvMapperConfig().csvMapper()), dir.resolve("phonebook.csv"));
        service = new PhonebookService(store, new Paginator(), new SearchEngine());
        service.open();
        dispatcher = new CommandDispatcher(service);
    }

    private String run(final String... lines) {
        return run(dispatcher, lines);
    }

    private static String run(final CommandDispatcher commandDispatcher, final String... lines) {
        final StringWriter output = new StringWriter();
        final BufferedReader in = new BufferedReader(new StringReader(String.join("\n", lines) + "\n"));
        new ConsoleSession(commandDispatcher, 10, in, new PrintWriter(output)).run();
        return output.toString();
    }

    @Test
    void addReasksForInvalidPhoneThenListsTheNewContact() {
        final String output = run(
                "2", "Иванов", "Иван", "Иванович", "ООО Ромашка",
                "84951234567", "+7 (495) 123-45-67", "+7 (916) 765-43-21",
                "1", "1", "",
                "0");

        assertThat(output)
                .contains("Ошибка: Телефон рабочий: некорректный формат телефона '84951234567'")
                .contains("Запись добавлена успешно (ID 1).")
                .contains("Страница 1 из 1:")
                .contains("ID: 1 | Фамилия: Иванов | Имя: Иван | Отчество: Иванович | Организация: ООО Ромашка"
                        + " | Телефон рабочий: +7 (495) 123-45-67 | Телефон личный: +7 (916) 765-43-21");
        assertThat(service.size()).isEqualTo(1);
    }

    @Test
    void addReasksForBlankField() {
        final String output = run(
                "2", "   ", "Иванов", "Иван", "Иванович", "ООО Ромашка",
                TestContacts.WORK_PHONE, TestContacts.PERSONAL_PHONE,
                "0");

        assertThat(output).contains("Ошибка: Фамилия не может быть пустым.");
        assertThat(service.find(1).orElseThrow().record().getLastName()).isEqualTo("Иванов");
    }

    @Test
    void editShowsCurrentRecordAndKeepsBlankFields() {
        service.add(TestContacts.draft("Иванов"));

        final String output = run("3", "1", "", "", "", "Ivanov LLC", "", "", "0");

        assertThat(output)
                .contains("Текущая запись:")
                .contains("Организация [ООО Ромашка]: ")
                .contains("Запись отредактирована успешно.");
        assertThat(service.find(1).orElseThrow().record().getOrganization()).isEqualTo("Ivanov LLC");
        assertThat(service.find(1).orElseThrow().record().getLastName()).isEqualTo("Иванов");
    }

    @Test
    void editOfUnknownIndexIsReported() {
        service.add(TestContacts.draft("Иванов"));

        final String output = run("3", "5", "0");

        assertThat(output).contains("Некорректный индекс записи 5. Выберите индекс от 1 до 1.");
        assertThat(output).doesNotContain("Текущая запись:");
    }

    @Test
    void searchReasksOnBlankTermAndPrintsMatches() {
        service.add(TestContacts.draft("Иванов", "Ivanov LLC"));
        service.add(TestContacts.draft("Петров"));

        final String output = run("4", "   ", "ivanov", "4", "Сидоров", "0");

        assertThat(output)
                .contains("Ошибка: Введите корректный текст для поиска.")
                .contains("Результаты поиска:")
                .contains("ID: 1 | Фамилия: Иванов")
                .doesNotContain("ID: 2 | Фамилия: Петров")
                .contains("Ничего не найдено.");
    }

    @Test
    void unknownChoiceAndNonNumericInputAreReasked() {
        final String output = run("9", "1", "abc", "1", "", "0");

        assertThat(output)
                .contains("Некорректный выбор. Пожалуйста, выберите снова.")
                .contains("Ошибка: введите целое число.")
                .contains("На странице 1 нет записей (всего страниц: 0).");
    }

    @Test
    void endOfInputEndsSession() {
        final String output = run("1");

        assertThat(output).contains("Введите номер страницы: ");
    }

    @Test
    void storageFailureEndsSession() {
        final CommandDispatcher failing = mock(CommandDispatcher.class);
        when(failing.dispatch(any())).thenThrow(new PhonebookPersistenceException(
                "Could not write phonebook file phonebook.csv", dir, new IOException("disk full")));

        final String output = run(failing, "4", "Иванов", "4", "Петров");

        assertThat(output).contains("Ошибка хранилища: Could not write phonebook file phonebook.csv");
        assertThat(output.indexOf("Введите текст для поиска: "))
                .isEqualTo(output.lastIndexOf("Введите текст для поиска: "));
    }
}
