package com.verso.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

@DisplayName("VersionerProperties")
class VersionerPropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    private static VersionerProperties minimal(String url, String username) {
        return new VersionerProperties(url, username, null, null, null, null, false, null, true);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("optional fields fall back to defaults")
        void appliesDefaults() {
            var props = minimal("jdbc:postgresql://localhost:5432/orders", "orders");

            assertThat(props.locations()).isEqualTo("classpath:db/versions");
            assertThat(props.table()).isEqualTo("schema_version");
            assertThat(props.logLevel()).isEqualTo(Level.INFO);
            assertThat(props.targetVersion()).isNull();
            assertThat(props.transactional()).isFalse();
        }

        @Test
        @DisplayName("explicit values are kept")
        void keepsExplicitValues() {
            var props =
                    new VersionerProperties(
                            "jdbc:postgresql://localhost:5432/orders",
                            "orders",
                            "secret",
                            "classpath:db/orders",
                            "ops.versions",
                            4,
                            true,
                            Level.DEBUG,
                            true);

            assertThat(props.locations()).isEqualTo("classpath:db/orders");
            assertThat(props.table()).isEqualTo("ops.versions");
            assertThat(props.targetVersion()).isEqualTo(4);
            assertThat(props.logLevel()).isEqualTo(Level.DEBUG);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Constraints {

        @Test
        @DisplayName("url and username are enough")
        void minimalIsValid() {
            assertThat(validator.validate(minimal("jdbc:postgresql://db/orders", "orders")))
                    .isEmpty();
        }

        @Test
        @DisplayName("blank url and username are rejected")
        void blankRejected() {
            Set<ConstraintViolation<VersionerProperties>> violations =
                    validator.validate(minimal(" ", null));

            assertThat(violations)
                    .extracting(v -> v.getPropertyPath().toString())
                    .containsOnly("url", "username");
        }
    }
}
