/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.audit.controller.advice;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.audit.rules.RuleConfigurationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception handler for the audit controller.
 *
 * <p>Translates invalid input into HTTP 400 responses with the problems listed, instead
 * of generic 500 errors.</p>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.fireflyframework.audit.controller")
public class DataAuditExceptionHandler {

    @ExceptionHandler(RuleConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleRuleConfigurationException(RuleConfigurationException ex) {
        log.warn("Business rule configuration rejected: {}", ex.getMessage());
        return badRequest("Invalid Business Rules", ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedTable(IllegalArgumentException ex) {
        log.warn("Malformed table rejected: {}", ex.getMessage());
        return badRequest("Malformed Table", ex.getMessage(), List.of(ex.getMessage()));
    }

    private ResponseEntity<Map<String, Object>> badRequest(String error, String message, List<String> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", 400);
        body.put("error", error);
        body.put("message", message);
        body.put("errors", errors);
        body.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
