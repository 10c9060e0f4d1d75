package dev.quire.config;

import dev.quire.document.DocumentException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps chunking failures to RFC 9457 Problem Detail responses.
 *
 * <p>Both unusable input ({@link DocumentException}) and invalid chunking parameters ({@link
 * IllegalArgumentException}) are client errors and map to HTTP 400 Bad Request.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(DocumentException.class)
  ProblemDetail handleDocument(DocumentException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Unusable document");
    return problem;
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by configuration validation
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }
}
