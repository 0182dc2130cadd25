package com.credcore.backend.global;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채어 공통 응답(ApiError)으로 변환한다.
 * - HTTP 상태코드도 ErrorCode/ApiException에서만 결정되게 한다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 전용 핸들러
     *
     * - 비즈니스 로직이 의도적으로 던진 예외를 처리한다.
     * - retryAfterSeconds가 있으면 Retry-After 헤더도 같이 내려줌(특히 429)
     * - 5xx는 원인 추적이 필요하므로 error 로그를 남긴다.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("요청 처리 실패: code={}", e.getCode(), e);
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatus());

        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }

        return builder.body(ApiError.from(e));
    }

    /**
     * @RequestBody + @Valid 검증 실패
     * - 응답은 VALIDATION_ERROR로 통일한다. (상세는 로그로만)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {

        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("요청 검증 실패: field={}, message={}", fe.getField(), fe.getDefaultMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /**
     * @RequestParam / @PathVariable / @Validated 검증 실패(제약 위반)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {

        e.getConstraintViolations()
                .forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.getPropertyPath(), v.getMessage()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    // JSON 파싱 불가 / 필수 헤더 누락
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("요청 본문/헤더 해석 실패: {}", e.getMessage());
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /**
     * 저장소 계층 장애(커넥션/제약/락 등 서비스가 따로 매핑하지 않은 것)
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException e) {
        log.error("저장소 예외", e);
        return ResponseEntity
                .status(ErrorCode.PERSISTENCE_ERROR.status())
                .body(ApiError.of(ErrorCode.PERSISTENCE_ERROR));
    }

    /**
     * 처리되지 않은 예외(버그/장애)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }

}
