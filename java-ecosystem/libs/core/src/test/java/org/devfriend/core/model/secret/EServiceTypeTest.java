package org.devfriend.core.model.secret;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EServiceType")
class EServiceTypeTest {

    @Test
    @DisplayName("OAuth-capable types should expect client id and secret")
    void oauthTypesShouldExpectClientCredentials() {
        assertThat(EServiceType.GITHUB.getExpectedFields()).containsExactly("client_id", "client_secret");
        assertThat(EServiceType.GMAIL.getExpectedFields()).containsExactly("client_id", "client_secret");
        assertThat(EServiceType.SLACK.getExpectedFields()).containsExactly("client_id", "client_secret");
        assertThat(EServiceType.CUSTOM.getExpectedFields()).isEmpty();
    }

    @Nested
    @DisplayName("fromId")
    class FromId {

        @ParameterizedTest
        @CsvSource({
                "github, GITHUB",
                "GitHub, GITHUB",
                "gmail, GMAIL",
                "email, GMAIL",
                "google, GMAIL",
                "slack, SLACK",
                "' custom ', CUSTOM"
        })
        @DisplayName("should parse ids and aliases")
        void shouldParseIdsAndAliases(String input, String expected) {
            assertThat(EServiceType.fromId(input)).isEqualTo(EServiceType.valueOf(expected));
        }

        @ParameterizedTest
        @NullSource
        @DisplayName("should reject null")
        void shouldRejectNull(String input) {
            assertThatThrownBy(() -> EServiceType.fromId(input))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cannot be null");
        }

        @ParameterizedTest
        @ValueSource(strings = {"gitlab", "", "teams"})
        @DisplayName("should reject unknown ids")
        void shouldRejectUnknownIds(String input) {
            assertThatThrownBy(() -> EServiceType.fromId(input))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown service type");
        }
    }
}
