package phonebook.domain.error;

/**
 * An edit or lookup targeted a record number outside {@code [1, size]}.
 *
 * @param index the requested one-based index
 * @param size  number of records at the time of the request
 */
public record IndexOutOfRangeError(int index, int size) implements DirectoryError {

    @Override
    public String message() {
        if (size == 0) {
            return "Некорректный индекс записи " + index + ": справочник пуст.";
        }
        return "Некорректный индекс записи " + index + ". Выберите индекс от 1 до " + size + ".";
    }
}
