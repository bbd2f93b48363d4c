package com.forumapi.domain.user;

import com.forumapi.commons.exceptions.ValidationException;
import com.forumapi.commons.exceptions.ValidationException.Kind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegisterUserTest {

    @Test
    void from_shouldExposeDeclaredFields() {
        RegisterUser user = RegisterUser.from(Map.of(
                "username", "dicoding",
                "password", "abc",
                "fullname", "Dicoding Indonesia",
                "extra", "ignored"));

        assertThat(user).isEqualTo(new RegisterUser("dicoding", "abc", "Dicoding Indonesia"));
    }

    @Test
    void from_shouldRejectUsernameLongerThanFiftyCharacters() {
        var payload = Map.of("username", "d".repeat(51), "password", "abc", "fullname", "Dicoding");

        assertThatThrownBy(() -> RegisterUser.from(payload))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(Kind.USERNAME_LIMIT_CHAR));
    }

    @Test
    void from_shouldRejectRestrictedCharacters() {
        var payload = Map.of("username", "dico ding", "password", "abc", "fullname", "Dicoding");

        assertThatThrownBy(() -> RegisterUser.from(payload))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo("REGISTER_USER.USERNAME_CONTAIN_RESTRICTED_CHARACTER"));
    }

    @Test
    void withPassword_shouldReplaceOnlyPassword() {
        var user = new RegisterUser("dicoding", "plain", "Dicoding");

        assertThat(user.withPassword("hashed")).isEqualTo(new RegisterUser("dicoding", "hashed", "Dicoding"));
    }
}
