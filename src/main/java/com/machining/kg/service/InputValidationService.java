package com.machining.kg.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Validates questions before they reach the resolver.
 * Rejects oversized input and obvious prompt injection; normalises whitespace.
 */
@Service
@Slf4j
public class InputValidationService {

    @Value("${machining.query.max-length:500}")
    private int maxQuestionLength;

    private static final Pattern SUSPICIOUS_PATTERNS = Pattern.compile(
            "(ignore\\s+(all\\s+|the\\s+)?(previous|above)|system\\s+prompt|忽略(以上|之前|前面)|<script|javascript:|\\bon\\w+\\s*=)",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Validate a question for length and injection attempts
     * @param question the user's question
     * @throws IllegalArgumentException if the question is empty or too long
     * @throws SecurityException if the question contains suspicious patterns
     */
    public void validateQuestion(String question) {
        if (question == null || question.trim().isEmpty()) {
            throw new IllegalArgumentException("Question cannot be empty");
        }

        if (question.length() > maxQuestionLength) {
            log.warn("Question too long: {} chars (max: {})", question.length(), maxQuestionLength);
            throw new IllegalArgumentException(
                    String.format("Question too long (max %d characters)", maxQuestionLength)
            );
        }

        if (SUSPICIOUS_PATTERNS.matcher(question).find()) {
            log.warn("Suspicious question detected: {}", question);
            throw new SecurityException("Question contains suspicious instructions");
        }
    }

    /**
     * Trim and collapse whitespace
     */
    public String sanitize(String question) {
        if (question == null) {
            return "";
        }
        return question.trim().replaceAll("\\s+", " ");
    }
}
