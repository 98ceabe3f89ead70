package phonebook.service;

import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;
import phonebook.domain.ContactEntry;

/**
 * Fixed-size pages over the directory.
 *
 * <p>Out-of-range requests never fail: a page number below 1, a non-positive page size or a
 * page past the end all give an empty page.
 */
@Component
public class Paginator {

    /**
     * Returns page {@code pageNumber} of {@code entries}.
     *
     * @param entries    the full collection, in directory order
     * @param pageNumber one-based page number
     * @param pageSize   entries per page
     * @return up to {@code pageSize} entries starting at {@code (pageNumber - 1) * pageSize}
     */
    public List<ContactEntry> page(final List<ContactEntry> entries, final int pageNumber, final int pageSize) {
        Objects.requireNonNull(entries, "entries must not be null");
        if (pageNumber < 1 || pageSize < 1) {
            return List.of();
        }
        // long arithmetic: a large page number times a large size must not wrap to a valid offset
        final long start = (long) (pageNumber - 1) * pageSize;
        if (start >= entries.size()) {
            return List.of();
        }
        final int end = (int) Math.min(start + pageSize, entries.size());
        return List.copyOf(entries.subList((int) start, end));
    }

    /**
     * @return number of pages needed for {@code total} entries, 0 when there is nothing to show
     */
    public int pageCount(final int total, final int pageSize) {
        if (total < 1 || pageSize < 1) {
            return 0;
        }
        return (int) (((long) total + pageSize - 1) / pageSize);
    }
}
