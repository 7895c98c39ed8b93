package org.codesync.web;

import org.codesync.sync.CapabilityRejectedException;
import org.codesync.sync.ConfirmRaceLostException;
import org.codesync.sync.JobNotFoundException;
import org.codesync.sync.SyncValidationException;
import org.codesync.sync.VersionConflictException;
import org.codesync.sync.WorkspaceAccessDeniedException;
import org.codesync.sync.WorkspaceNotFoundException;
import org.codesync.sync.blob.BlobContentMismatchException;
import org.codesync.sync.blob.BlobTooLargeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.nio.file.NoSuchFileException;

/**
 * 把同步协议的异常映射为 HTTP 状态码。
 * <p>
 * sync/confirm 的冲突由控制器直接以响应状态返回，这里只兜底处理异常路径。
 */
@RestControllerAdvice
public class SyncExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SyncExceptionHandler.class);

    @ExceptionHandler(SyncValidationException.class)
    public ResponseEntity<ErrorResponse> validation(SyncValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler({WorkspaceNotFoundException.class, JobNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(NoSuchFileException.class)
    public ResponseEntity<ErrorResponse> missingObject(NoSuchFileException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", "对象不存在");
    }

    @ExceptionHandler(CapabilityRejectedException.class)
    public ResponseEntity<ErrorResponse> capability(CapabilityRejectedException e) {
        if (e.isExpired()) {
            return respond(HttpStatus.GONE, "capability_expired", e.getMessage());
        }
        return respond(HttpStatus.FORBIDDEN, "capability_rejected", e.getMessage());
    }

    @ExceptionHandler(WorkspaceAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> accessDenied(WorkspaceAccessDeniedException e) {
        return respond(HttpStatus.FORBIDDEN, "forbidden", e.getMessage());
    }

    @ExceptionHandler(BlobContentMismatchException.class)
    public ResponseEntity<ErrorResponse> contentMismatch(BlobContentMismatchException e) {
        return respond(HttpStatus.CONFLICT, "content_mismatch", e.getMessage());
    }

    @ExceptionHandler(BlobTooLargeException.class)
    public ResponseEntity<ErrorResponse> tooLarge(BlobTooLargeException e) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "payload_too_large", e.getMessage());
    }

    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<ErrorResponse> versionConflict(VersionConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("error", "workspace_conflict", e.getMessage(), e.getCurrentVersion()));
    }

    @ExceptionHandler(ConfirmRaceLostException.class)
    public ResponseEntity<ErrorResponse> raceLost(ConfirmRaceLostException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("error", e.getReason().value(), e.getMessage(), e.getCurrentVersion()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("请求处理失败", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "服务器内部错误");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, message));
    }
}
