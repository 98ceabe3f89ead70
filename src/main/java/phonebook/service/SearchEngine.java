package phonebook.service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;
import phonebook.domain.ContactEntry;
import phonebook.domain.ContactField;
import phonebook.domain.Result;
import phonebook.domain.error.EmptyQueryError;

/**
 * Case-insensitive substring search across every column.
 *
 * <p>An entry matches when any of its values, the positional ID included, contains the term.
 * Results keep directory order; there is no ranking.
 */
@Component
public class SearchEngine {

    /**
     * @param entries entries to scan, in directory order
     * @param term    text to look for, matched as given apart from case
     * @return matching entries, or {@link EmptyQueryError} for a blank term
     */
    public Result<List<ContactEntry>, EmptyQueryError> search(final List<ContactEntry> entries, final String term) {
        Objects.requireNonNull(entries, "entries must not be null");
        if (term == null || term.isBlank()) {
            return Result.err(new EmptyQueryError());
        }
        final String needle = term.toLowerCase(Locale.ROOT);
        final List<ContactEntry> matches = entries.stream()
                .filter(entry -> matches(entry, needle))
                .toList();
        return Result.ok(matches);
    }

    private static boolean matches(final ContactEntry entry, final String needle) {
        for (final ContactField field : ContactField.values()) {
            if (entry.get(field).toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
