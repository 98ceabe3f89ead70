package phonebook.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactEntry;
import phonebook.domain.ContactField;
import phonebook.domain.ContactUpdate;
import phonebook.domain.Result;
import phonebook.domain.Validation;
import phonebook.domain.error.DirectoryError;
import phonebook.persistence.PhonebookStorageException;

/**
 * One interactive menu session.
 *
 * <p>Collects primitive values from the reader, turns them into {@link DirectoryCommand}s and
 * prints the {@link CommandResult}s. Field values are checked as they are typed so the user is
 * asked again for just the field that was wrong.
 *
 * <p>The session ends on choice {@code 0}, at end of input, or after a storage failure.
 */
public class ConsoleSession {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleSession.class);

    private final CommandDispatcher dispatcher;
    private final int defaultPageSize;
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleSession(
            final CommandDispatcher dispatcher,
            final int defaultPageSize,
            final BufferedReader in,
            final PrintWriter out) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.defaultPageSize = defaultPageSize;
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Runs the menu loop until the user exits.
     */
    public void run() {
        try {
            boolean running = true;
            while (running) {
                printMenu();
                running = handle(prompt("Выберите действие: ").trim());
            }
        } catch (EndOfInput e) {
            LOG.debug("Input closed, ending session");
        } catch (PhonebookStorageException e) {
            LOG.error("Storage failure, ending session", e);
            out.println("Ошибка хранилища: " + e.getMessage());
        }
        out.flush();
    }

    private boolean handle(final String choice) {
        switch (choice) {
            case "1":
                listPage();
                return true;
            case "2":
                addContact();
                return true;
            case "3":
                editContact();
                return true;
            case "4":
                search();
                return true;
            case "0":
                return false;
            default:
                out.println("Некорректный выбор. Пожалуйста, выберите снова.");
                return true;
        }
    }

    private void printMenu() {
        out.println();
        out.println("Меню:");
        out.println("1. Вывод постранично записей из справочника");
        out.println("2. Добавление новой записи в справочник");
        out.println("3. Возможность редактирования записей в справочнике");
        out.println("4. Поиск записей по одной или нескольким характеристикам");
        out.println("0. Выход");
    }

    private void listPage() {
        final int pageNumber = promptInt("Введите номер страницы: ", null);
        final int pageSize = promptInt(
                "Введите количество записей на странице [" + defaultPageSize + "]: ", defaultPageSize);
        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.ListPage(pageNumber, pageSize));
        if (result instanceof CommandResult.PageShown page) {
            if (page.entries().isEmpty()) {
                out.println("На странице " + page.pageNumber() + " нет записей (всего страниц: "
                        + page.pageCount() + ").");
                return;
            }
            out.println("Страница " + page.pageNumber() + " из " + page.pageCount() + ":");
            printEntries(page.entries());
        } else {
            report(result);
        }
    }

    private void addContact() {
        final String[] values = new String[ContactField.textFields().size()];
        int i = 0;
        for (final ContactField field : ContactField.textFields()) {
            values[i++] = promptField(field, null);
        }
        final ContactDraft draft = new ContactDraft(values[0], values[1], values[2], values[3], values[4], values[5]);
        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.AddContact(draft));
        if (result instanceof CommandResult.ContactAdded added) {
            out.println("Запись добавлена успешно (ID " + added.entry().id() + ").");
        } else {
            report(result);
        }
    }

    private void editContact() {
        final int index = promptInt("Введите индекс записи для редактирования: ", null);
        final CommandResult shown = dispatcher.dispatch(new DirectoryCommand.ShowContact(index));
        if (!(shown instanceof CommandResult.ContactShown current)) {
            report(shown);
            return;
        }
        out.println("Текущая запись:");
        out.println(format(current.entry()));
        out.println("Оставьте поле пустым, чтобы сохранить текущее значение.");

        final ContactUpdate.Builder update = ContactUpdate.builder();
        for (final ContactField field : ContactField.textFields()) {
            update.set(field, promptField(field, current.entry().get(field)));
        }
        final CommandResult result = dispatcher.dispatch(new DirectoryCommand.EditContact(index, update.build()));
        if (result instanceof CommandResult.ContactEdited) {
            out.println("Запись отредактирована успешно.");
        } else {
            report(result);
        }
    }

    private void search() {
        while (true) {
            final String term = prompt("Введите текст для поиска: ");
            final CommandResult result = dispatcher.dispatch(new DirectoryCommand.Search(term));
            if (result instanceof CommandResult.SearchCompleted completed) {
                if (completed.matches().isEmpty()) {
                    out.println("Ничего не найдено.");
                } else {
                    out.println("Результаты поиска:");
                    printEntries(completed.matches());
                }
                return;
            }
            report(result);
        }
    }

    /**
     * Asks for one field until the value is acceptable.
     *
     * @param current value kept on blank input, or null when the field is required
     * @return the raw accepted value, or null when the current value is kept
     */
    private String promptField(final ContactField field, final String current) {
        final String hint = field.isPhone() ? " (+7 (XXX) XXX-XX-XX)" : "";
        final String keep = current == null ? "" : " [" + current + "]";
        while (true) {
            final String raw = prompt(field.label() + hint + keep + ": ");
            if (current != null && raw.isBlank()) {
                return null;
            }
            final Result<String, DirectoryError> checked = Validation.validateField(field, raw);
            if (checked.isOk()) {
                return raw;
            }
            out.println("Ошибка: " + checked.error().message());
        }
    }

    private int promptInt(final String text, final Integer defaultValue) {
        while (true) {
            final String raw = prompt(text).trim();
            if (raw.isEmpty() && defaultValue != null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                out.println("Ошибка: введите целое число.");
            }
        }
    }

    private String prompt(final String text) {
        out.print(text);
        out.flush();
        final String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read console input", e);
        }
        if (line == null) {
            throw new EndOfInput();
        }
        return line;
    }

    private void report(final CommandResult result) {
        if (result instanceof CommandResult.Rejected rejected) {
            out.println("Ошибка: " + rejected.error().message());
        } else {
            throw new IllegalStateException("Unexpected result " + result);
        }
    }

    private void printEntries(final List<ContactEntry> entries) {
        for (final ContactEntry entry : entries) {
            out.println(format(entry));
        }
    }

    static String format(final ContactEntry entry) {
        final StringJoiner line = new StringJoiner(" | ");
        for (final ContactField field : ContactField.values()) {
            line.add(field.label() + ": " + entry.get(field));
        }
        return line.toString();
    }

    /** Input ended before the session finished. */
    private static final class EndOfInput extends RuntimeException {
        private static final long serialVersionUID = 1L;

        EndOfInput() {
            super(null, null, false, false);
        }
    }
}
