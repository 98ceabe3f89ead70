package phonebook.console;

import java.util.Objects;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactUpdate;

/**
 * A request from a front end, built from values the user has already entered.
 */
public sealed interface DirectoryCommand {

    /**
     * Show one page of the directory.
     */
    record ListPage(int pageNumber, int pageSize) implements DirectoryCommand {
    }

    /**
     * Show a single record by its one-based number.
     */
    record ShowContact(int index) implements DirectoryCommand {
    }

    /**
     * Append a new record.
     */
    record AddContact(ContactDraft draft) implements DirectoryCommand {

        public AddContact {
            Objects.requireNonNull(draft, "draft must not be null");
        }
    }

    /**
     * Replace some fields of an existing record.
     */
    record EditContact(int index, ContactUpdate update) implements DirectoryCommand {

        public EditContact {
            Objects.requireNonNull(update, "update must not be null");
        }
    }

    /**
     * Find records containing a term in any field.
     */
    record Search(String term) implements DirectoryCommand {
    }
}
