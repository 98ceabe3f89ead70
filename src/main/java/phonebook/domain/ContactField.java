package phonebook.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Columns of the directory in file order.
 *
 * <p>The label is the column header written to the backing file and the field name used in
 * validation messages.
 */
public enum ContactField {
    ID("ID", false),
    LAST_NAME("Фамилия", false),
    FIRST_NAME("Имя", false),
    PATRONYMIC("Отчество", false),
    ORGANIZATION("Организация", false),
    WORK_PHONE("Телефон рабочий", true),
    PERSONAL_PHONE("Телефон личный", true);

    private static final List<ContactField> TEXT_FIELDS = Arrays.stream(values())
            .filter(field -> field != ID)
            .toList();

    private final String label;
    private final boolean phone;

    ContactField(final String label, final boolean phone) {
        this.label = label;
        this.phone = phone;
    }

    public String label() {
        return label;
    }

    public boolean isPhone() {
        return phone;
    }

    /**
     * @return the six caller-supplied fields, i.e. every column except {@link #ID}
     */
    public static List<ContactField> textFields() {
        return TEXT_FIELDS;
    }

    /**
     * @return header labels of all seven columns in file order
     */
    public static List<String> headerLabels() {
        return Arrays.stream(values()).map(ContactField::label).toList();
    }
}
