package com.example.vibescore.web;

import com.example.vibescore.application.InsufficientMaterialException;
import com.example.vibescore.application.NoHistoryException;
import com.example.vibescore.application.QuizStateException;
import com.example.vibescore.application.RepositoryUnavailableException;
import com.example.vibescore.application.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LogManager.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RepositoryUnavailableException.class)
    public ProblemDetail repositoryUnavailable(RepositoryUnavailableException e) {
        log.warn(e.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Repository unavailable", e.getMessage());
    }

    @ExceptionHandler(NoHistoryException.class)
    public ProblemDetail noHistory(NoHistoryException e) {
        log.warn(e.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "No history", e.getMessage());
    }

    @ExceptionHandler(InsufficientMaterialException.class)
    public ProblemDetail insufficientMaterial(InsufficientMaterialException e) {
        log.info(e.getMessage());
        ProblemDetail detail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient material", e.getMessage());
        detail.setProperty("track", e.getTrack());
        detail.setProperty("available", e.getAvailable());
        detail.setProperty("required", e.getRequired());
        return detail;
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ProblemDetail sessionNotFound(SessionNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "Session not found", e.getMessage());
    }

    @ExceptionHandler(QuizStateException.class)
    public ProblemDetail quizState(QuizStateException e) {
        return problem(HttpStatus.CONFLICT, "Invalid quiz state", e.getMessage());
    }

    @ExceptionHandler({InvalidRequestException.class, HttpMessageNotReadableException.class})
    public ProblemDetail badRequest(Exception e) {
        return problem(HttpStatus.BAD_REQUEST, "Bad request", e.getMessage());
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
