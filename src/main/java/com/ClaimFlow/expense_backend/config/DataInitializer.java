package com.ClaimFlow.expense_backend.config;

import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.model.User;
import com.ClaimFlow.expense_backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@Profile("!test")
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final DefaultAdminConfig defaultAdminConfig;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> createDefaultAdminIfMissing();
    }

    private void createDefaultAdminIfMissing() {
        String username = defaultAdminConfig.getUsername();

        if (userRepository.existsByUsername(username)) {
            log.info("Admin user '{}' already exists", username);
            return;
        }
        if (defaultAdminConfig.getPassword() == null || defaultAdminConfig.getPassword().isBlank()) {
            log.warn("No admin.default.password configured; skipping bootstrap admin creation");
            return;
        }

        User admin = User.builder()
                .username(username)
                .email(defaultAdminConfig.getEmail())
                .password(passwordEncoder.encode(defaultAdminConfig.getPassword()))
                .fullName(defaultAdminConfig.getFullName())
                .employeeCode(defaultAdminConfig.getEmployeeCode())
                .department(defaultAdminConfig.getDepartment())
                .grade(defaultAdminConfig.getGrade())
                .role(Role.ADMIN)
                .active(defaultAdminConfig.isEnabled())
                .build();

        userRepository.save(admin);
        log.info("Default admin user '{}' created", username);
    }
}
