package com.example.cachesync.validate;

import com.example.cachesync.error.ValidationException;
import com.example.cachesync.model.DocumentFields;
import com.example.cachesync.model.FieldValue;
import com.example.cachesync.model.Identifiers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdentifierValidator Tests")
class IdentifierValidatorTest {

    private final IdentifierValidator validator = new IdentifierValidator();

    @Test
    @DisplayName("Should extract both identifiers")
    void shouldExtractBothIdentifiers() {
        DocumentFields fields = DocumentFields.of(Map.of(
                "parentId", new FieldValue.StringValue("p1"),
                "childId", new FieldValue.StringValue("c1")));

        assertThat(validator.validate(fields)).isEqualTo(new Identifiers("p1", "c1"));
    }

    @Test
    @DisplayName("Should accept a document without parentId")
    void shouldAcceptMissingParent() {
        DocumentFields fields = DocumentFields.of(Map.of("childId", new FieldValue.StringValue("c1")));

        Identifiers identifiers = validator.validate(fields);

        assertThat(identifiers.hasParent()).isFalse();
        assertThat(identifiers.childId()).isEqualTo("c1");
    }

    @Test
    @DisplayName("Should treat a blank parentId as absent")
    void shouldTreatBlankParentAsAbsent() {
        DocumentFields fields = DocumentFields.of(Map.of(
                "parentId", new FieldValue.StringValue("  "),
                "childId", new FieldValue.StringValue("c1")));

        assertThat(validator.validate(fields).parentId()).isNull();
    }

    @Test
    @DisplayName("Should reject a missing childId")
    void shouldRejectMissingChild() {
        DocumentFields fields = DocumentFields.of(Map.of("parentId", new FieldValue.StringValue("p1")));

        assertThatThrownBy(() -> validator.validate(fields))
                .isInstanceOf(ValidationException.class)
                .hasMessage("missing childId");
    }

    @Test
    @DisplayName("Should reject a blank or non-string childId")
    void shouldRejectBlankOrNonStringChild() {
        assertThatThrownBy(() -> validator.validate(
                DocumentFields.of(Map.of("childId", new FieldValue.StringValue("")))))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(
                DocumentFields.of(Map.of("childId", new FieldValue.IntegerValue(42)))))
                .isInstanceOf(ValidationException.class);
    }
}
