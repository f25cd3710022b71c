package com.spreadsheet.calc.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches engine exceptions from the controllers or services,
 * returning error JSON with an HTTP 4xx code instead of 500.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FormulaParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(FormulaParseException ex) {
        return respond("PARSE_ERROR", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex) {
        return respond("CIRCULAR_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidArgumentsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArguments(InvalidArgumentsException ex) {
        return respond("INVALID_ARGUMENTS", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidAddressException ex) {
        return respond("INVALID_ADDRESS", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return respond("SHEET_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(BatchNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleBatchNotFound(BatchNotFoundException ex) {
        return respond("BATCH_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(BatchStateException.class)
    public ResponseEntity<ErrorResponse> handleBatchState(BatchStateException ex) {
        return respond("BATCH_STATE", ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(DuplicateSheetException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateSheet(DuplicateSheetException ex) {
        return respond("DUPLICATE_SHEET", ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> respond(String code, RuntimeException ex, HttpStatus status) {
        log.warn("{}: {}", code, ex.getMessage());
        ErrorResponse error = ErrorResponse.of(code, ex);
        return new ResponseEntity<>(error, status);
    }
}
