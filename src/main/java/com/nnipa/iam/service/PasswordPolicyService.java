package com.nnipa.iam.service;

import lombok.extern.slf4j.Slf4j;
import org.passay.CharacterRule;
import org.passay.DictionaryRule;
import org.passay.EnglishCharacterData;
import org.passay.LengthRule;
import org.passay.PasswordData;
import org.passay.PasswordValidator;
import org.passay.RuleResult;
import org.passay.UsernameRule;
import org.passay.WhitespaceRule;
import org.passay.dictionary.ArrayWordList;
import org.passay.dictionary.WordListDictionary;
import org.passay.dictionary.sort.ArraysSort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Password strength rules applied to every newly chosen password.
 */
@Slf4j
@Service
public class PasswordPolicyService {

    static final int MIN_PASSWORD_LENGTH = 8;
    static final int MAX_PASSWORD_LENGTH = 128;

    private static final String[] COMMON_PASSWORDS = {
            "password", "password1", "password123", "password1!", "p@ssw0rd", "p@ssword1",
            "passw0rd!", "qwerty123", "qwerty1!", "letmein1!", "welcome1", "welcome1!",
            "admin123", "admin123!", "changeme1!", "iloveyou1", "abc12345", "12345678",
            "123456789", "summer2024!", "winter2024!", "spring2024!", "autumn2024!", "bank1234!"
    };

    private final PasswordValidator validator;

    public PasswordPolicyService() {
        this.validator = new PasswordValidator(List.of(
                new LengthRule(MIN_PASSWORD_LENGTH, MAX_PASSWORD_LENGTH),
                new CharacterRule(EnglishCharacterData.UpperCase, 1),
                new CharacterRule(EnglishCharacterData.LowerCase, 1),
                new CharacterRule(EnglishCharacterData.Digit, 1),
                new CharacterRule(EnglishCharacterData.Special, 1),
                new WhitespaceRule(),
                new DictionaryRule(new WordListDictionary(
                        new ArrayWordList(COMMON_PASSWORDS.clone(), false, new ArraysSort()))),
                new UsernameRule(true, true)
        ));
    }

    /**
     * Validate a candidate password for the given email address.
     *
     * @return rule violation messages; empty when the password is acceptable
     */
    public List<String> validate(String password, String email) {
        if (password == null || password.isEmpty()) {
            return List.of("Password must not be empty");
        }
        String localPart = localPart(email);
        PasswordData data = localPart == null ? new PasswordData(password) : new PasswordData(localPart, password);
        RuleResult result = validator.validate(data);
        if (result.isValid()) {
            return List.of();
        }
        List<String> messages = validator.getMessages(result);
        log.debug("Password rejected with {} violation(s)", messages.size());
        return messages;
    }

    private static String localPart(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at).trim() : email.trim();
    }
}
