package ru.vavtech.leavetracker.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Глобальный обработчик исключений REST API учета отпусков.
 * Все ошибки возвращаются в одном формате: timestamp, status, error, message, path.
 */
@Slf4j
@ControllerAdvice
public class LeaveExceptionHandler {

    /**
     * Обработка общих исключений, в том числе недоступности хранилища
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, WebRequest request) {
        log.error("Необработанная ошибка в сервисе учета отпусков", ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Техническая ошибка",
                "Попробуйте позже или обратитесь в службу поддержки", request);
    }

    /**
     * Не заполнены обязательные поля заявки
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
                                                                            WebRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .sorted()
                .collect(Collectors.joining("; "));
        log.warn("Некорректная заявка: {}", message);
        return buildResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса", message, request);
    }

    /**
     * Тело запроса не читается: битый JSON, неизвестный вид отпуска, дата не в формате ISO-8601
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleNotReadable(HttpMessageNotReadableException ex,
                                                                 WebRequest request) {
        log.warn("Не удалось прочитать тело запроса: {}", ex.getMostSpecificCause().getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса",
                "Некорректный формат запроса", request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                      WebRequest request) {
        log.warn("Не передан параметр {}", ex.getParameterName());
        return buildResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса",
                "Не передан параметр " + ex.getParameterName(), request);
    }

    /**
     * Обработка ошибок валидации входных данных
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(IllegalArgumentException ex,
                                                                         WebRequest request) {
        log.warn("Ошибка валидации: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса", ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownEmployeeException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownEmployee(UnknownEmployeeException ex,
                                                                     WebRequest request) {
        log.warn(ex.getMessage());
        return buildResponse(HttpStatus.NOT_FOUND, "Сотрудник не найден", ex.getMessage(), request);
    }

    @ExceptionHandler(LeaveRequestNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRequestNotFound(LeaveRequestNotFoundException ex,
                                                                     WebRequest request) {
        log.warn(ex.getMessage());
        return buildResponse(HttpStatus.NOT_FOUND, "Заявка не найдена", ex.getMessage(), request);
    }

    private ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, String error, String message,
                                                              WebRequest request) {
        Map<String, Object> errorDetails = Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message,
                "path", request.getDescription(false)
        );
        return ResponseEntity.status(status).body(errorDetails);
    }
}
