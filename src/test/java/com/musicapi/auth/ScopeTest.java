package com.musicapi.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeTest {

    @Test
    @DisplayName("Should parse a space separated scope field and skip unknown ids")
    void shouldParseScopeField() {
        assertThat(Scope.parse("user-library-read  user-follow-read\tmade-up-scope"))
                .containsExactlyInAnyOrder(Scope.USER_LIBRARY_READ, Scope.USER_FOLLOW_READ);
    }

    @Test
    @DisplayName("Should parse null or blank fields to no scopes")
    void shouldParseBlankField() {
        assertThat(Scope.parse(null)).isEmpty();
        assertThat(Scope.parse("   ")).isEmpty();
    }

    @Test
    @DisplayName("Should map wire ids both ways")
    void shouldMapWireIds() {
        assertThat(Scope.fromId("playlist-modify-public")).contains(Scope.PLAYLIST_MODIFY_PUBLIC);
        assertThat(Scope.fromId("nope")).isEmpty();
        assertThat(Scope.USER_TOP_READ).hasToString("user-top-read");
    }

    @Test
    @DisplayName("Should keep the token value out of toString")
    void shouldHideTokenValue() {
        AccessToken token = AccessToken.of("secret-value", "user-top-read");

        assertThat(token.grantedScopes()).containsExactly(Scope.USER_TOP_READ);
        assertThat(token.toString()).doesNotContain("secret-value");
        assertThat(AccessToken.of("secret-value").grantedScopes()).isEmpty();
    }
}
