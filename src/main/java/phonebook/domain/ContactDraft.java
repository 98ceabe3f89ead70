package phonebook.domain;

/**
 * Raw values collected for a new contact, before validation.
 *
 * @param lastName      last name
 * @param firstName     first name
 * @param patronymic    patronymic
 * @param organization  organization
 * @param workPhone     work phone, {@code +7 (XXX) XXX-XX-XX}
 * @param personalPhone personal phone, {@code +7 (XXX) XXX-XX-XX}
 */
public record ContactDraft(
        String lastName,
        String firstName,
        String patronymic,
        String organization,
        String workPhone,
        String personalPhone
) {

    /**
     * @param field any column except {@link ContactField#ID}
     * @return the raw value entered for that column
     */
    public String get(final ContactField field) {
        switch (field) {
            case LAST_NAME:
                return lastName;
            case FIRST_NAME:
                return firstName;
            case PATRONYMIC:
                return patronymic;
            case ORGANIZATION:
                return organization;
            case WORK_PHONE:
                return workPhone;
            case PERSONAL_PHONE:
                return personalPhone;
            default:
                throw new IllegalArgumentException("draft has no value for " + field);
        }
    }
}
