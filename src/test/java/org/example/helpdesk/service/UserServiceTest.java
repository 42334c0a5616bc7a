package org.example.helpdesk.service;

import org.example.helpdesk.dto.UserCreateRequest;
import org.example.helpdesk.dto.UserDTO;
import org.example.helpdesk.dto.UserUpdateRequest;
import org.example.helpdesk.entity.User;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.exception.DuplicateEmailException;
import org.example.helpdesk.exception.ForbiddenException;
import org.example.helpdesk.exception.InvalidCredentialsException;
import org.example.helpdesk.exception.InvalidOperationException;
import org.example.helpdesk.exception.UserNotFoundException;
import org.example.helpdesk.mapper.UserMapper;
import org.example.helpdesk.repository.TicketRepository;
import org.example.helpdesk.repository.UserRepository;
import org.example.helpdesk.security.RequestIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService Tests")
class UserServiceTest {

    private static final String DUMMY_HASH = "$2a$10$dummy";

    @Mock
    private UserRepository userRepository;

    @Mock
    private TicketRepository ticketRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private UserService userService;

    @BeforeEach
    void setUp() {
        when(passwordEncoder.encode("helpdesk-timing-equalizer")).thenReturn(DUMMY_HASH);
        userService = new UserService(userRepository, ticketRepository, passwordEncoder, new UserMapper());
    }

    private static User user(Long id, UserRole role, boolean active) {
        return User.builder()
                .id(id)
                .email("user" + id + "@helpdesk.test")
                .passwordHash("$2a$10$stored")
                .firstName("Test")
                .lastName("User")
                .role(role)
                .active(active)
                .build();
    }

    // ==================== AUTHENTICATE ====================

    @Test
    @DisplayName("authenticate should return the user for matching credentials")
    void authenticate_shouldReturnUser_whenPasswordMatches() {
        // Arrange
        User stored = user(1L, UserRole.AGENT, true);
        when(userRepository.findByEmail("user1@helpdesk.test")).thenReturn(Optional.of(stored));
        when(passwordEncoder.matches("secret123", "$2a$10$stored")).thenReturn(true);

        // Act
        User result = userService.authenticate("  User1@Helpdesk.TEST ", "secret123");

        // Assert
        assertThat(result).isSameAs(stored);
    }

    @Test
    @DisplayName("authenticate should still run a hash check for an unknown email")
    void authenticate_shouldCompareDummyHash_whenEmailUnknown() {
        when(userRepository.findByEmail("ghost@helpdesk.test")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.authenticate("ghost@helpdesk.test", "whatever"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid email or password");
        verify(passwordEncoder).matches("whatever", DUMMY_HASH);
    }

    @Test
    @DisplayName("authenticate should reject a wrong password with the generic message")
    void authenticate_shouldReject_wrongPassword() {
        when(userRepository.findByEmail("user1@helpdesk.test")).thenReturn(Optional.of(user(1L, UserRole.AGENT, true)));
        when(passwordEncoder.matches("wrong", "$2a$10$stored")).thenReturn(false);

        assertThatThrownBy(() -> userService.authenticate("user1@helpdesk.test", "wrong"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid email or password");
    }

    @Test
    @DisplayName("authenticate should reject an inactive account with the generic message")
    void authenticate_shouldReject_inactiveAccount() {
        when(userRepository.findByEmail("user2@helpdesk.test")).thenReturn(Optional.of(user(2L, UserRole.END_USER, false)));
        when(passwordEncoder.matches("secret123", "$2a$10$stored")).thenReturn(true);

        assertThatThrownBy(() -> userService.authenticate("user2@helpdesk.test", "secret123"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid email or password");
    }

    // ==================== CREATE ====================

    @Test
    @DisplayName("createUser should store a lower-cased email and a hashed password")
    void createUser_shouldHashPasswordAndNormalizeEmail() {
        // Arrange
        UserCreateRequest request = UserCreateRequest.builder()
                .email("New.Agent@Helpdesk.test")
                .password("password123")
                .firstName(" Nia ")
                .lastName("Agent")
                .department("IT")
                .role(UserRole.AGENT)
                .build();
        when(userRepository.existsByEmail("new.agent@helpdesk.test")).thenReturn(false);
        when(passwordEncoder.encode("password123")).thenReturn("$2a$10$hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            saved.setId(10L);
            return saved;
        });

        // Act
        UserDTO result = userService.createUser(request);

        // Assert
        assertThat(result.getId()).isEqualTo(10L);
        assertThat(result.getEmail()).isEqualTo("new.agent@helpdesk.test");
        assertThat(result.getFirstName()).isEqualTo("Nia");
        assertThat(result.getRole()).isEqualTo(UserRole.AGENT);
        verify(userRepository).save(argThat(user -> "$2a$10$hashed".equals(user.getPasswordHash())));
    }

    @Test
    @DisplayName("createUser should reject a duplicate email")
    void createUser_shouldReject_duplicateEmail() {
        when(userRepository.existsByEmail("taken@helpdesk.test")).thenReturn(true);

        assertThatThrownBy(() -> userService.createUser("Taken@helpdesk.test", "password123",
                "Ann", "Other", "IT", UserRole.END_USER))
                .isInstanceOf(DuplicateEmailException.class);
        verify(userRepository, never()).save(any());
        verify(passwordEncoder, never()).encode("password123");
    }

    // ==================== STAFF / DELETE ====================

    @Test
    @DisplayName("requireActiveStaff should reject end users and inactive staff")
    void requireActiveStaff_shouldRejectNonAssignableUsers() {
        when(userRepository.findById(3L)).thenReturn(Optional.of(user(3L, UserRole.END_USER, true)));
        when(userRepository.findById(4L)).thenReturn(Optional.of(user(4L, UserRole.AGENT, false)));
        when(userRepository.findById(5L)).thenReturn(Optional.of(user(5L, UserRole.ADMIN, true)));

        assertThatThrownBy(() -> userService.requireActiveStaff(3L))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("agent or admin");
        assertThatThrownBy(() -> userService.requireActiveStaff(4L))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("inactive");
        assertThat(userService.requireActiveStaff(5L).getId()).isEqualTo(5L);
    }

    @Test
    @DisplayName("loadUser should throw for an unknown id")
    void loadUser_shouldThrow_whenMissing() {
        when(userRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.loadUser(99L)).isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("deleteUser should be refused while tickets reference the user")
    void deleteUser_shouldReject_whenReferenced() {
        User agent = user(6L, UserRole.AGENT, true);
        when(userRepository.findById(6L)).thenReturn(Optional.of(agent));
        when(ticketRepository.countReferencingUser(6L)).thenReturn(2L);

        assertThatThrownBy(() -> userService.deleteUser(6L))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("2 ticket(s) still reference this user");
        verify(userRepository, never()).delete(any(User.class));
    }

    @Test
    @DisplayName("deleteUser should remove an unreferenced user")
    void deleteUser_shouldDelete_whenUnreferenced() {
        User agent = user(7L, UserRole.AGENT, true);
        when(userRepository.findById(7L)).thenReturn(Optional.of(agent));
        when(ticketRepository.countReferencingUser(7L)).thenReturn(0L);

        userService.deleteUser(7L);

        verify(userRepository).delete(agent);
    }

    @Test
    @DisplayName("setActive should flip the active flag")
    void setActive_shouldUpdateFlag() {
        User agent = user(8L, UserRole.AGENT, true);
        when(userRepository.findById(8L)).thenReturn(Optional.of(agent));
        when(userRepository.save(agent)).thenReturn(agent);

        UserDTO result = userService.setActive(8L, false);

        assertThat(result.getIsActive()).isFalse();
    }

    // ==================== UPDATE ====================

    @Test
    @DisplayName("updateUser should let a user edit their own name and department")
    void updateUser_shouldApplyProfileFields_whenSelf() {
        // Arrange
        User self = user(9L, UserRole.END_USER, true);
        when(userRepository.findById(9L)).thenReturn(Optional.of(self));
        when(userRepository.save(self)).thenReturn(self);
        UserUpdateRequest request = UserUpdateRequest.builder()
                .firstName(" Renamed ")
                .department("Finance")
                .build();

        // Act
        UserDTO result = userService.updateUser(9L, request,
                new RequestIdentity(9L, "user9@helpdesk.test", UserRole.END_USER));

        // Assert
        assertThat(result.getFirstName()).isEqualTo("Renamed");
        assertThat(result.getLastName()).isEqualTo("User");
        assertThat(result.getDepartment()).isEqualTo("Finance");
        assertThat(result.getRole()).isEqualTo(UserRole.END_USER);
    }

    @Test
    @DisplayName("updateUser should stop an end user from promoting themselves")
    void updateUser_shouldReject_selfPromotion() {
        UserUpdateRequest request = UserUpdateRequest.builder().role(UserRole.ADMIN).build();
        RequestIdentity caller = new RequestIdentity(9L, "user9@helpdesk.test", UserRole.END_USER);

        assertThatThrownBy(() -> userService.updateUser(9L, request, caller))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Only admins can change role or active status");
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("updateUser should stop an agent from reactivating or editing someone else")
    void updateUser_shouldReject_nonAdminChanges() {
        RequestIdentity agent = new RequestIdentity(200L, "agent@helpdesk.test", UserRole.AGENT);

        assertThatThrownBy(() -> userService.updateUser(200L,
                UserUpdateRequest.builder().isActive(true).build(), agent))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Only admins can change role or active status");
        assertThatThrownBy(() -> userService.updateUser(9L,
                UserUpdateRequest.builder().firstName("Other").build(), agent))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("You can only update your own profile");
        verify(userRepository, never()).findById(any());
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("updateUser should let an admin change another user's role and active flag")
    void updateUser_shouldApplyPrivilegedFields_whenAdmin() {
        User target = user(11L, UserRole.END_USER, true);
        when(userRepository.findById(11L)).thenReturn(Optional.of(target));
        when(userRepository.save(target)).thenReturn(target);
        UserUpdateRequest request = UserUpdateRequest.builder().role(UserRole.AGENT).isActive(false).build();

        UserDTO result = userService.updateUser(11L, request,
                new RequestIdentity(1L, "admin@helpdesk.test", UserRole.ADMIN));

        assertThat(result.getRole()).isEqualTo(UserRole.AGENT);
        assertThat(result.getIsActive()).isFalse();
        assertThat(result.getFirstName()).isEqualTo("Test");
    }
}
