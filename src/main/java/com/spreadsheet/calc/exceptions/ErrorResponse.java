package com.spreadsheet.calc.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.spreadsheet.calc.models.CellAddress;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Error body returned by the REST layer. The optional fields are only present
 * for the failures they describe, e.g.
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Circular reference: B1 -> A1 -> B1",
 *   "cycle": ["B1", "A1", "B1"]
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final List<String> cycle;
    private final Integer position;

    public ErrorResponse(String code, String message) {
        this(code, message, null, null);
    }

    private ErrorResponse(String code, String message, List<String> cycle, Integer position) {
        this.code = code;
        this.message = message;
        this.cycle = cycle;
        this.position = position;
    }

    /**
     * Builds the body for {@code ex}, filling in the cycle path or parse position when it has one.
     */
    public static ErrorResponse of(String code, RuntimeException ex) {
        if (ex instanceof CircularReferenceException) {
            List<String> path = ((CircularReferenceException) ex).getCycle().stream()
                    .map(CellAddress::toA1)
                    .collect(Collectors.toList());
            return new ErrorResponse(code, ex.getMessage(), path, null);
        }
        if (ex instanceof FormulaParseException) {
            return new ErrorResponse(code, ex.getMessage(), null, ((FormulaParseException) ex).getPosition());
        }
        return new ErrorResponse(code, ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * A1 addresses of the loop, starting and ending with the cell being written.
     */
    public List<String> getCycle() {
        return cycle;
    }

    /**
     * Character offset in the formula where parsing stopped.
     */
    public Integer getPosition() {
        return position;
    }
}
