package eu.virtualparadox.companion.catalog.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.nio.file.Path;

/**
 * Stores blob locations as their absolute string form.
 */
@Converter(autoApply = true)
public class PathConverter implements AttributeConverter<Path, String> {

    @Override
    public String convertToDatabaseColumn(final Path attribute) {
        return attribute == null ? null : attribute.toAbsolutePath().toString();
    }

    @Override
    public Path convertToEntityAttribute(final String dbData) {
        return dbData == null ? null : Path.of(dbData);
    }
}
