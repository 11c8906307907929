package org.devfriend.core.model.integration;

import org.devfriend.core.model.secret.EServiceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EOAuthProvider")
class EOAuthProviderTest {

    @ParameterizedTest
    @CsvSource({
            "google, GOOGLE",
            "gmail, GOOGLE",
            "email, GOOGLE",
            "GitHub, GITHUB",
            "slack, SLACK"
    })
    @DisplayName("fromId should accept path ids and service aliases")
    void fromIdShouldAcceptAliases(String input, String expected) {
        assertThat(EOAuthProvider.fromId(input)).isEqualTo(EOAuthProvider.valueOf(expected));
    }

    @Test
    @DisplayName("fromId should reject unknown providers")
    void fromIdShouldRejectUnknown() {
        assertThatThrownBy(() -> EOAuthProvider.fromId("bitbucket"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown OAuth provider");
    }

    @Test
    @DisplayName("each provider should map to its service type and back")
    void shouldMapToServiceType() {
        for (EOAuthProvider provider : EOAuthProvider.values()) {
            assertThat(EOAuthProvider.forServiceType(provider.getServiceType())).isEqualTo(provider);
        }
        assertThat(EOAuthProvider.GOOGLE.getServiceType()).isEqualTo(EServiceType.GMAIL);
    }

    @Test
    @DisplayName("custom service type has no OAuth provider")
    void customHasNoProvider() {
        assertThatThrownBy(() -> EOAuthProvider.forServiceType(EServiceType.CUSTOM))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
