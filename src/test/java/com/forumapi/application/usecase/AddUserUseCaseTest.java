package com.forumapi.application.usecase;

import com.forumapi.application.security.PasswordHash;
import com.forumapi.commons.exceptions.InvariantException;
import com.forumapi.commons.exceptions.ValidationException;
import com.forumapi.domain.user.RegisterUser;
import com.forumapi.domain.user.RegisteredUser;
import com.forumapi.domain.user.UserRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AddUserUseCaseTest {

    private static final Map<String, Object> PAYLOAD = Map.of(
            "username", "dicoding",
            "password", "secret",
            "fullname", "Dicoding Indonesia");

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordHash passwordHash;

    @InjectMocks
    private AddUserUseCase useCase;

    @Test
    void execute_shouldStoreHashedPasswordAndReturnRegisteredUser() {
        var expected = new RegisteredUser("user-123", "dicoding", "Dicoding Indonesia");
        when(passwordHash.hash("secret")).thenReturn("encrypted");
        when(userRepository.addUser(new RegisterUser("dicoding", "encrypted", "Dicoding Indonesia")))
                .thenReturn(expected);

        RegisteredUser registered = useCase.execute(PAYLOAD);

        assertThat(registered).isEqualTo(expected);
        verify(userRepository).verifyAvailableUsername("dicoding");
    }

    @Test
    void execute_shouldFailWhenUsernameIsTaken() {
        doThrow(new InvariantException("username is not available"))
                .when(userRepository).verifyAvailableUsername("dicoding");

        assertThatThrownBy(() -> useCase.execute(PAYLOAD))
                .isInstanceOf(InvariantException.class)
                .hasMessage("username is not available");
        verify(userRepository, never()).addUser(any());
        verifyNoInteractions(passwordHash);
    }

    @Test
    void execute_shouldValidateBeforeTouchingRepository() {
        assertThatThrownBy(() -> useCase.execute(Map.of("username", "dicoding")))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(userRepository, passwordHash);
    }
}
