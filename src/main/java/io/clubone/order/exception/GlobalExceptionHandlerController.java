package io.clubone.order.exception;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandlerController {

	private final static String EXCEPTION_NAME = "inside handleOnRunTimeExceptions method, exception name is :";

	private final static String TYPE = "errorType";

	@ExceptionHandler(value = RuntimeException.class)
	public ProblemDetail handleOnRunTimeExceptions(RuntimeException exception) {
		ProblemDetail problemDetail;
		if (exception instanceof ResourceNotFoundException || exception instanceof LookupNotFoundException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, exception.getMessage());
			problemDetail.setProperty(TYPE, ExceptionType.LIFECYCLE.getType());
			log.error(EXCEPTION_NAME + "{} and statusCode is {}", exception.getClass().getSimpleName(), 404);
		} else if (exception instanceof InvalidTransitionException transition) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, exception.getMessage());
			problemDetail.setProperty(TYPE, ExceptionType.LIFECYCLE.getType());
			problemDetail.setProperty("action", transition.getAction().getActionName());
			log.error(EXCEPTION_NAME + "InvalidTransitionException and statusCode is {}", 409);
		} else if (exception instanceof StaleWriteException stale) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, exception.getMessage());
			problemDetail.setProperty(TYPE, ExceptionType.TRANSPORT.getType());
			problemDetail.setProperty("operation", stale.getOperation());
			log.error(EXCEPTION_NAME + "StaleWriteException and statusCode is {}", 409);
		} else if (exception instanceof TransportException transport) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, exception.getMessage());
			problemDetail.setProperty(TYPE, ExceptionType.TRANSPORT.getType());
			problemDetail.setProperty("operation", transport.getOperation());
			if (transport.getUpstreamStatus() != null) {
				problemDetail.setProperty("upstreamStatus", transport.getUpstreamStatus());
			}
			log.error(EXCEPTION_NAME + "TransportException and statusCode is {}", 502, exception);
		} else if (exception instanceof NotValidException) {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
			problemDetail.setProperty(TYPE, ExceptionType.VALIDATION.getType());
			log.error(EXCEPTION_NAME + "NotValidException and statusCode is {}", 400);
		} else {
			problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, exception.getMessage());
			problemDetail.setProperty(TYPE, ExceptionType.ERROR.getType());
			log.error(EXCEPTION_NAME + "RuntimeException and statusCode is {}", 500, exception);
		}
		return problemDetail;
	}

	@ResponseStatus(HttpStatus.BAD_REQUEST)
	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidationExceptions(MethodArgumentNotValidException ex) {
		StringBuilder stringBuilder = new StringBuilder();
		ex.getBindingResult().getAllErrors().forEach(obj -> {
			if (obj instanceof FieldError fieldError) {
				stringBuilder.append(fieldError.getField() + " : " + obj.getDefaultMessage() + ",");
			} else {
				stringBuilder.append(obj.getObjectName() + " : " + obj.getDefaultMessage() + ",");
			}
		});
		ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST,
				StringUtils.chop(stringBuilder.toString()));
		problemDetail.setProperty(TYPE, ExceptionType.VALIDATION.getType());
		return problemDetail;
	}
}
