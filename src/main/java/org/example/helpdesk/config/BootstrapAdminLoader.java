package org.example.helpdesk.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.entity.User;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.repository.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Creates the first admin account at startup when
 * {@code helpdesk.bootstrap-admin.email} and {@code .password} are set and no
 * user with that email exists yet. Without it nobody could create staff users.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BootstrapAdminLoader implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${helpdesk.bootstrap-admin.email:}")
    private String email;

    @Value("${helpdesk.bootstrap-admin.password:}")
    private String password;

    @Value("${helpdesk.bootstrap-admin.first-name:System}")
    private String firstName;

    @Value("${helpdesk.bootstrap-admin.last-name:Administrator}")
    private String lastName;

    @Override
    public void run(String... args) {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            log.debug("No bootstrap admin configured. Skipping.");
            return;
        }

        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmail(normalizedEmail)) {
            log.info("Bootstrap admin {} already exists. Skipping.", normalizedEmail);
            return;
        }

        User admin = User.builder()
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(password))
                .firstName(firstName)
                .lastName(lastName)
                .department("IT")
                .role(UserRole.ADMIN)
                .active(true)
                .build();
        userRepository.save(admin);
        log.info("✅ Bootstrap admin created: {}", normalizedEmail);
    }
}
