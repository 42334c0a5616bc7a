package org.example.helpdesk.service;

import lombok.extern.slf4j.Slf4j;
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
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Credential store and user administration.
 *
 * <p>Emails are compared lower-cased. Password hashes never leave this class.</p>
 */
@Slf4j
@Service
@Transactional
public class UserService {

    private final UserRepository userRepository;
    private final TicketRepository ticketRepository;
    private final PasswordEncoder passwordEncoder;
    private final UserMapper userMapper;

    /** Compared against when the email is unknown so both paths cost one BCrypt check. */
    private final String dummyPasswordHash;

    public UserService(UserRepository userRepository,
                       TicketRepository ticketRepository,
                       PasswordEncoder passwordEncoder,
                       UserMapper userMapper) {
        this.userRepository = userRepository;
        this.ticketRepository = ticketRepository;
        this.passwordEncoder = passwordEncoder;
        this.userMapper = userMapper;
        this.dummyPasswordHash = passwordEncoder.encode("helpdesk-timing-equalizer");
    }

    // ==================== CREDENTIALS ====================

    /**
     * Checks an email/password pair.
     *
     * @throws InvalidCredentialsException for an unknown email, a wrong password
     *                                     or an inactive account alike
     */
    @Transactional(readOnly = true)
    public User authenticate(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        User user = userRepository.findByEmail(normalizedEmail).orElse(null);

        if (user == null) {
            passwordEncoder.matches(password, dummyPasswordHash);
            log.warn("[LOGIN_FAILED] Unknown email (timing protected) | email={}", normalizedEmail);
            throw new InvalidCredentialsException();
        }

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("[LOGIN_FAILED] Invalid password | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        if (!user.isActive()) {
            log.warn("[LOGIN_FAILED] Inactive account | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        return user;
    }

    @Transactional(readOnly = true)
    public User loadUser(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new UserNotFoundException(id));
    }

    /**
     * Loads a user who may be given tickets.
     *
     * @throws UserNotFoundException if no such user exists
     * @throws InvalidOperationException if the user is not active staff
     */
    @Transactional(readOnly = true)
    public User requireActiveStaff(Long id) {
        User user = loadUser(id);
        if (!user.getRole().isStaff()) {
            throw new InvalidOperationException("assign ticket", "assignee must be an agent or admin");
        }
        if (!user.isActive()) {
            throw new InvalidOperationException("assign ticket", "assignee account is inactive");
        }
        return user;
    }

    // ==================== CREATE ====================

    public User createUser(String email, String rawPassword, String firstName, String lastName,
                           String department, UserRole role) {
        String normalizedEmail = normalizeEmail(email);
        log.info("👤 Creating user {} with role {}", normalizedEmail, role);

        if (userRepository.existsByEmail(normalizedEmail)) {
            log.warn("⚠️ Duplicate email: {}", normalizedEmail);
            throw new DuplicateEmailException(normalizedEmail);
        }

        User user = User.builder()
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(rawPassword))
                .firstName(firstName.trim())
                .lastName(lastName.trim())
                .department(department)
                .role(role != null ? role : UserRole.END_USER)
                .active(true)
                .build();

        User saved = userRepository.save(user);
        log.info("✅ User created with ID: {}", saved.getId());
        return saved;
    }

    public UserDTO createUser(UserCreateRequest request) {
        User user = createUser(request.getEmail(), request.getPassword(), request.getFirstName(),
                request.getLastName(), request.getDepartment(), request.getRole());
        return userMapper.toDTO(user);
    }

    // ==================== READ ====================

    @Transactional(readOnly = true)
    public UserDTO getUser(Long id) {
        return userMapper.toDTO(loadUser(id));
    }

    @Transactional(readOnly = true)
    public List<UserDTO> listUsers(UserRole role) {
        List<User> users = role != null
                ? userRepository.findByRoleOrderByIdAsc(role)
                : userRepository.findAllByOrderByIdAsc();
        return users.stream().map(userMapper::toDTO).toList();
    }

    // ==================== UPDATE ====================

    /**
     * Users may edit their own name and department. Anything touching another
     * account, or the role and active flag of any account, needs an admin.
     *
     * @throws ForbiddenException if the caller may not make this change
     */
    public UserDTO updateUser(Long id, UserUpdateRequest request, RequestIdentity caller) {
        boolean admin = caller.role() == UserRole.ADMIN;
        if (!admin && !caller.userId().equals(id)) {
            log.warn("⚠️ User {} tried to update user {}", caller.userId(), id);
            throw new ForbiddenException("You can only update your own profile");
        }
        if (!admin && request.changesPrivileges()) {
            log.warn("⚠️ User {} tried to change role or active status of user {}", caller.userId(), id);
            throw new ForbiddenException("Only admins can change role or active status");
        }

        User user = loadUser(id);
        if (StringUtils.hasText(request.getFirstName())) {
            user.setFirstName(request.getFirstName().trim());
        }
        if (StringUtils.hasText(request.getLastName())) {
            user.setLastName(request.getLastName().trim());
        }
        if (request.getDepartment() != null) {
            user.setDepartment(request.getDepartment().trim());
        }
        if (request.getRole() != null) {
            user.setRole(request.getRole());
        }
        if (request.getIsActive() != null) {
            user.setActive(request.getIsActive());
        }

        User saved = userRepository.save(user);
        log.info("✅ User {} updated by {}", id, caller.userId());
        return userMapper.toDTO(saved);
    }

    /**
     * Deactivated users can no longer log in. Tokens already issued stay valid until they expire.
     */
    public UserDTO setActive(Long id, boolean active) {
        User user = loadUser(id);
        user.setActive(active);
        User saved = userRepository.save(user);
        log.info("✅ User {} {}", id, active ? "activated" : "deactivated");
        return userMapper.toDTO(saved);
    }

    // ==================== DELETE ====================

    /**
     * @throws InvalidOperationException while any ticket still references the user
     */
    public void deleteUser(Long id) {
        log.info("🗑️ Deleting user with ID: {}", id);
        User user = loadUser(id);

        long references = ticketRepository.countReferencingUser(id);
        if (references > 0) {
            throw new InvalidOperationException("delete user",
                    references + " ticket(s) still reference this user; reassign them first");
        }

        userRepository.delete(user);
        log.info("✅ User deleted: {}", id);
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
