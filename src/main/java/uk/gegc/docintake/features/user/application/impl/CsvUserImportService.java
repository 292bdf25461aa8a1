package uk.gegc.docintake.features.user.application.impl;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.docintake.features.upload.domain.UploadedBlob;
import uk.gegc.docintake.features.user.application.ImportOutcome;
import uk.gegc.docintake.features.user.application.UserImportService;
import uk.gegc.docintake.features.user.domain.model.User;
import uk.gegc.docintake.features.user.domain.model.UserRole;
import uk.gegc.docintake.features.user.domain.repository.UserRepository;
import uk.gegc.docintake.shared.exception.FatalPersistenceException;
import uk.gegc.docintake.shared.exception.ValidationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CsvUserImportService implements UserImportService {

    private static final int REQUIRED_COLUMNS = 4;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Validator validator;
    private final TransactionTemplate transactionTemplate;

    @Override
    public ImportOutcome importUsers(UploadedBlob csv) {
        List<User> created = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> batchUsernames = new HashSet<>();
        Set<String> batchEmails = new HashSet<>();
        int failureCount = 0;

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(csv.openStream(), StandardCharsets.UTF_8))) {
            String header = reader.readLine();
            if (header == null) {
                return new ImportOutcome(0, 0, List.of("Empty file"));
            }

            int lineNumber = 1;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }

                Optional<String> rowError = processRow(line, lineNumber, created, batchUsernames, batchEmails);
                if (rowError.isPresent()) {
                    failureCount++;
                    errors.add(rowError.get());
                    log.debug("Import row rejected: {}", rowError.get());
                }
            }
        } catch (IOException e) {
            throw new ValidationException("Failed to read CSV payload: " + e.getMessage(), e);
        }

        if (!created.isEmpty()) {
            commit(created);
        }

        ImportOutcome outcome = new ImportOutcome(created.size(), failureCount, errors);
        log.info("User import finished for {}: {}", csv.name(), outcome.summary());
        return outcome;
    }

    private Optional<String> processRow(String line, int lineNumber, List<User> created,
                                        Set<String> batchUsernames, Set<String> batchEmails) {
        String[] values = line.split(",", -1);
        if (values.length < REQUIRED_COLUMNS) {
            return Optional.of("Line " + lineNumber + ": Invalid format. Expected Username,Email,Password,Role");
        }

        String username = values[0].trim();
        String email = values[1].trim();
        String password = values[2].trim();
        String roleToken = values[3].trim();

        if (username.isEmpty() || email.isEmpty() || password.isEmpty()) {
            return Optional.of("Line " + lineNumber + ": Missing required fields.");
        }

        Optional<UserRole> role = UserRole.fromToken(roleToken);
        if (role.isEmpty()) {
            return Optional.of("Line " + lineNumber + ": Invalid role '" + roleToken + "'.");
        }

        if (batchUsernames.contains(username) || userRepository.existsByUsername(username)) {
            return Optional.of("Line " + lineNumber + ": User '" + username + "' already exists.");
        }

        String emailKey = email.toLowerCase(Locale.ROOT);
        if (batchEmails.contains(emailKey) || userRepository.existsByEmailIgnoreCase(email)) {
            return Optional.of("Line " + lineNumber + ": Email '" + email + "' already in use.");
        }

        try {
            User user = new User(username, email, passwordEncoder.encode(password), role.get());
            Set<ConstraintViolation<User>> violations = validator.validate(user);
            if (!violations.isEmpty()) {
                String message = violations.stream()
                        .map(v -> v.getPropertyPath() + " " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining("; "));
                return Optional.of("Line " + lineNumber + ": Error creating user. " + message);
            }
            created.add(user);
            batchUsernames.add(username);
            batchEmails.add(emailKey);
            return Optional.empty();
        } catch (RuntimeException e) {
            return Optional.of("Line " + lineNumber + ": Error creating user. " + e.getMessage());
        }
    }

    private void commit(List<User> users) {
        try {
            transactionTemplate.executeWithoutResult(status -> userRepository.saveAllAndFlush(users));
        } catch (DataAccessException | TransactionException e) {
            log.error("Batch commit of {} imported users failed", users.size(), e);
            throw new FatalPersistenceException("Failed to save imported users", e);
        }
    }
}
