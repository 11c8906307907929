package org.devfriend.webserver.exception;

import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.oauth.OAuthProviderException;
import org.devfriend.webserver.generic.dto.message.ErrorMessageResponse;
import org.devfriend.webserver.generic.dto.message.ReauthRequiredResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NoOAuthConfigException.class)
    public ResponseEntity<ErrorMessageResponse> handleNoOAuthConfig(NoOAuthConfigException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(ReauthRequiredException.class)
    public ResponseEntity<ReauthRequiredResponse> handleReauthRequired(ReauthRequiredException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ReauthRequiredResponse(ex));
    }

    @ExceptionHandler(OAuthStateException.class)
    public ResponseEntity<ErrorMessageResponse> handleOAuthState(OAuthStateException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.BAD_REQUEST));
    }

    /**
     * Invalid grant and config mismatch: the user has to restart the flow or fix the credential.
     */
    @ExceptionHandler(OAuthProviderException.class)
    public ResponseEntity<ErrorMessageResponse> handleOAuthProvider(OAuthProviderException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorMessageResponse> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn("Provider unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE));
    }

    @ExceptionHandler(ProviderClientException.class)
    public ResponseEntity<ErrorMessageResponse> handleProviderClient(ProviderClientException ex) {
        log.warn("Provider call failed: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.BAD_GATEWAY));
    }

    @ExceptionHandler({IntegrationNotFoundException.class, SecretNotFoundException.class})
    public ResponseEntity<ErrorMessageResponse> handleNotFound(RuntimeException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorMessageResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorMessageResponse(ex.getMessage(), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });
        return new ResponseEntity<>(errors, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorMessageResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorMessageResponse("An unexpected error occurred. Please try again later.", HttpStatus.INTERNAL_SERVER_ERROR));
    }
}
