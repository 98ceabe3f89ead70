package phonebook.domain;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Field overrides for editing an existing contact.
 *
 * <p>Only the fields that were set are applied; everything else keeps its current value.
 * Values are raw input and are validated when the update is applied.
 */
public final class ContactUpdate {

    private final Map<ContactField, String> overrides;

    private ContactUpdate(final Map<ContactField, String> overrides) {
        this.overrides = overrides;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the override for {@code field}, empty if the field is left untouched
     */
    public Optional<String> get(final ContactField field) {
        return Optional.ofNullable(overrides.get(field));
    }

    public boolean isEmpty() {
        return overrides.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContactUpdate)) {
            return false;
        }
        return overrides.equals(((ContactUpdate) o).overrides);
    }

    @Override
    public int hashCode() {
        return overrides.hashCode();
    }

    @Override
    public String toString() {
        return "ContactUpdate" + overrides;
    }

    /**
     * Collects overrides one field at a time.
     */
    public static final class Builder {

        private final Map<ContactField, String> overrides = new EnumMap<>(ContactField.class);

        private Builder() {
        }

        /**
         * Sets an override. A null value clears a previously set override.
         *
         * @throws IllegalArgumentException for {@link ContactField#ID}, which is positional
         */
        public Builder set(final ContactField field, final String value) {
            Objects.requireNonNull(field, "field must not be null");
            if (field == ContactField.ID) {
                throw new IllegalArgumentException("ID is positional and cannot be edited");
            }
            if (value == null) {
                overrides.remove(field);
            } else {
                overrides.put(field, value);
            }
            return this;
        }

        public Builder lastName(final String value) {
            return set(ContactField.LAST_NAME, value);
        }

        public Builder firstName(final String value) {
            return set(ContactField.FIRST_NAME, value);
        }

        public Builder patronymic(final String value) {
            return set(ContactField.PATRONYMIC, value);
        }

        public Builder organization(final String value) {
            return set(ContactField.ORGANIZATION, value);
        }

        public Builder workPhone(final String value) {
            return set(ContactField.WORK_PHONE, value);
        }

        public Builder personalPhone(final String value) {
            return set(ContactField.PERSONAL_PHONE, value);
        }

        public ContactUpdate build() {
            return new ContactUpdate(new EnumMap<>(overrides));
        }
    }
}
