package phonebook.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvReadFeature;
import tools.jackson.dataformat.csv.CsvWriteFeature;

/**
 * Jackson CSV configuration for the backing file.
 *
 * <ul>
 *   <li>{@code WRAP_AS_ARRAY}: rows are read as plain {@code String[]} so the header can be
 *       checked column by column before any row is interpreted</li>
 *   <li>{@code SKIP_EMPTY_LINES}: blank lines, e.g. a trailing one added by an editor, are not
 *       reported as rows</li>
 *   <li>{@code STRICT_CHECK_FOR_QUOTING}: values are quoted only when they contain a separator,
 *       quote or line break</li>
 * </ul>
 */
@Configuration
public class CsvMapperConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
                .enable(CsvReadFeature.WRAP_AS_ARRAY)
                .enable(CsvReadFeature.SKIP_EMPTY_LINES)
                .enable(CsvWriteFeature.STRICT_CHECK_FOR_QUOTING)
                .build();
    }
}
