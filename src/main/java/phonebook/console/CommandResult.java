package phonebook.console;

import java.util.List;
import phonebook.domain.ContactEntry;
import phonebook.domain.error.DirectoryError;

/**
 * What a {@link DirectoryCommand} produced, ready to be rendered.
 */
public sealed interface CommandResult {

    record PageShown(List<ContactEntry> entries, int pageNumber, int pageCount) implements CommandResult {

        public PageShown {
            entries = List.copyOf(entries);
        }
    }

    record ContactShown(ContactEntry entry) implements CommandResult {
    }

    record ContactAdded(ContactEntry entry) implements CommandResult {
    }

    record ContactEdited(ContactEntry entry) implements CommandResult {
    }

    record SearchCompleted(List<ContactEntry> matches) implements CommandResult {

        public SearchCompleted {
            matches = List.copyOf(matches);
        }
    }

    /**
     * The command was refused; nothing changed.
     */
    record Rejected(DirectoryError error) implements CommandResult {
    }
}
