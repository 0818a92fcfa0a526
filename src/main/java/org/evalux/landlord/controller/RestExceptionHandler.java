package org.evalux.landlord.controller;

import lombok.extern.slf4j.Slf4j;
import org.evalux.landlord.model.rules.InvalidModifierException;
import org.evalux.landlord.model.rules.ValidationError;
import org.evalux.landlord.service.BidValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Traduction des exceptions en réponses HTTP, corps {"error": ...}.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    // annonces invalides : message renvoyé tel quel pour être affiché
    @ExceptionHandler(BidValidationException.class)
    public ResponseEntity<Map<String, Object>> invalidBids(BidValidationException e) {
        ValidationError err = e.getError();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", err.kind().name());
        body.put("level", err.level());
        body.put("message", err.message());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(","));
        return ResponseEntity.badRequest().body(Map.of("error", "Requête invalide: " + details));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> notFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    // modificateur hors domaine arrivé jusqu'au calcul : bug interne, pas une erreur de saisie
    @ExceptionHandler(InvalidModifierException.class)
    public ResponseEntity<Map<String, Object>> invalidModifier(InvalidModifierException e) {
        log.error("Calcul des points appelé avec des modificateurs invalides", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Erreur interne"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        log.warn("Requête refusée: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
