package phonebook.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import phonebook.domain.ContactDraft;
import phonebook.domain.ContactEntry;
import phonebook.domain.ContactUpdate;
import phonebook.domain.Result;
import phonebook.domain.error.DirectoryError;
import phonebook.domain.error.EmptyQueryError;
import phonebook.persistence.RecordStore;

/**
 * Entry point to the directory for front ends.
 *
 * <p>Combines the {@link RecordStore} with the read-only {@link Paginator} and
 * {@link SearchEngine}. Front ends pass primitive values in and render what comes back; they
 * hold no validation or persistence logic of their own.
 */
@Service
public class PhonebookService {

    private static final Logger LOG = LoggerFactory.getLogger(PhonebookService.class);

    private final RecordStore store;
    private final Paginator paginator;
    private final SearchEngine searchEngine;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singletons injected by the container")
    public PhonebookService(final RecordStore store, final Paginator paginator, final SearchEngine searchEngine) {
        this.store = store;
        this.paginator = paginator;
        this.searchEngine = searchEngine;
    }

    /**
     * Loads the backing file. Must be called once before the directory is used.
     */
    public void open() {
        store.load();
    }

    public int size() {
        return store.size();
    }

    public List<ContactEntry> page(final int pageNumber, final int pageSize) {
        final List<ContactEntry> page = paginator.page(store.records(), pageNumber, pageSize);
        LOG.debug("Page {} (size {}) returned {} contacts", pageNumber, pageSize, page.size());
        return page;
    }

    public int pageCount(final int pageSize) {
        return paginator.pageCount(store.size(), pageSize);
    }

    public Optional<ContactEntry> find(final int oneBasedIndex) {
        return store.find(oneBasedIndex);
    }

    public Result<ContactEntry, DirectoryError> add(final ContactDraft draft) {
        final Result<ContactEntry, DirectoryError> result = store.add(draft);
        if (!result.isOk()) {
            LOG.debug("Rejected new contact: {}", result.error());
        }
        return result;
    }

    public Result<ContactEntry, DirectoryError> edit(final int oneBasedIndex, final ContactUpdate update) {
        final Result<ContactEntry, DirectoryError> result = store.edit(oneBasedIndex, update);
        if (!result.isOk()) {
            LOG.debug("Rejected edit of contact #{}: {}", oneBasedIndex, result.error());
        }
        return result;
    }

    public Result<List<ContactEntry>, EmptyQueryError> search(final String term) {
        final Result<List<ContactEntry>, EmptyQueryError> result = searchEngine.search(store.records(), term);
        if (result.isOk()) {
            LOG.debug("Search matched {} contacts", result.value().size());
        }
        return result;
    }
}
