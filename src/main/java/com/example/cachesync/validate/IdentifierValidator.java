package com.example.cachesync.validate;

import com.example.cachesync.error.ValidationException;
import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.Identifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Extracts entity identifiers from decoded document fields.
 */
@Slf4j
@Component
public class IdentifierValidator {

    public static final String PARENT_ID = "parentId";
    public static final String CHILD_ID = "childId";

    /**
     * @throws ValidationException when {@code childId} is absent or blank
     */
    public Identifiers validate(DocumentFields fields) {
        String childId = nonBlank(fields, CHILD_ID)
                .orElseThrow(() -> new ValidationException("missing childId"));
        Optional<String> parentId = nonBlank(fields, PARENT_ID);
        if (parentId.isEmpty()) {
            log.info("Document for child {} has no parentId, enrichment will run in reduced mode", childId);
            return Identifiers.childOnly(childId);
        }
        return new Identifiers(parentId.get(), childId);
    }

    private Optional<String> nonBlank(DocumentFields fields, String name) {
        return fields.getString(name)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
