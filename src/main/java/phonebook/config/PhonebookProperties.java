package phonebook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under the {@code phonebook} prefix.
 *
 * <pre>
 * phonebook:
 *   file: phonebook.csv
 *   default-page-size: 10
 *   console:
 *     enabled: true
 * </pre>
 *
 * @param file            path of the backing CSV file
 * @param defaultPageSize page size the console uses when the user leaves it blank
 * @param console         interactive console settings
 */
@ConfigurationProperties(prefix = "phonebook")
public record PhonebookProperties(
        @DefaultValue("phonebook.csv") String file,
        @DefaultValue("10") int defaultPageSize,
        @DefaultValue Console console
) {

    public PhonebookProperties {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("phonebook.file must not be blank");
        }
        if (defaultPageSize < 1) {
            throw new IllegalArgumentException("phonebook.default-page-size must be positive, was " + defaultPageSize);
        }
    }

    /**
     * @param enabled whether the interactive menu runs on startup
     */
    public record Console(@DefaultValue("true") boolean enabled) {
    }
}
