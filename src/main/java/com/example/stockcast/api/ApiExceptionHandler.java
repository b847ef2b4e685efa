package com.example.stockcast.api;

import com.example.stockcast.api.dto.SessionDtos.ApiError;
import com.example.stockcast.marketdata.HistoricalDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps failures to {@code {"error": "..."}} bodies with a matching status code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownInstrumentException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiError unknownInstrument(UnknownInstrumentException e) {
        return new ApiError(e.getMessage());
    }

    @ExceptionHandler(NoActiveInstrumentException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ApiError noActiveInstrument(NoActiveInstrumentException e) {
        return new ApiError(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError badArgument(IllegalArgumentException e) {
        return new ApiError(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiError invalidBody(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        return new ApiError(detail.isEmpty() ? "Invalid request" : detail);
    }

    @ExceptionHandler(HistoricalDataException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ApiError upstreamFailure(HistoricalDataException e) {
        log.warn("Market data request for {} failed: {}", e.getSymbol(), e.getMessage());
        return new ApiError(e.getMessage());
    }
}
