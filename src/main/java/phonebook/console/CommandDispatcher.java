package phonebook.console;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;
import phonebook.domain.ContactEntry;
import phonebook.domain.Result;
import phonebook.domain.error.DirectoryError;
import phonebook.domain.error.EmptyQueryError;
import phonebook.domain.error.IndexOutOfRangeError;
import phonebook.service.PhonebookService;

/**
 * Executes {@link DirectoryCommand}s against the {@link PhonebookService}.
 *
 * <p>Recoverable failures come back as {@link CommandResult.Rejected}; storage exceptions are
 * not caught here.
 */
@Component
public class CommandDispatcher {

    private final PhonebookService service;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton injected by the container")
    public CommandDispatcher(final PhonebookService service) {
        this.service = service;
    }

    public CommandResult dispatch(final DirectoryCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        if (command instanceof DirectoryCommand.ListPage listPage) {
            final List<ContactEntry> entries = service.page(listPage.pageNumber(), listPage.pageSize());
            return new CommandResult.PageShown(
                    entries, listPage.pageNumber(), service.pageCount(listPage.pageSize()));
        }
        if (command instanceof DirectoryCommand.ShowContact show) {
            final Optional<ContactEntry> entry = service.find(show.index());
            if (entry.isEmpty()) {
                return new CommandResult.Rejected(new IndexOutOfRangeError(show.index(), service.size()));
            }
            return new CommandResult.ContactShown(entry.get());
        }
        if (command instanceof DirectoryCommand.AddContact add) {
            final Result<ContactEntry, DirectoryError> added = service.add(add.draft());
            return added.isOk()
                    ? new CommandResult.ContactAdded(added.value())
                    : new CommandResult.Rejected(added.error());
        }
        if (command instanceof DirectoryCommand.EditContact edit) {
            final Result<ContactEntry, DirectoryError> edited = service.edit(edit.index(), edit.update());
            return edited.isOk()
                    ? new CommandResult.ContactEdited(edited.value())
                    : new CommandResult.Rejected(edited.error());
        }
        if (command instanceof DirectoryCommand.Search search) {
            final Result<List<ContactEntry>, EmptyQueryError> found = service.search(search.term());
            return found.isOk()
                    ? new CommandResult.SearchCompleted(found.value())
                    : new CommandResult.Rejected(found.error());
        }
        throw new IllegalArgumentException("Unsupported command: " + command);
    }
}
