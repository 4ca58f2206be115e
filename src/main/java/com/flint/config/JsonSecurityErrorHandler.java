package com.flint.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flint.dto.ErrorResponse;
import com.flint.error.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.csrf.CsrfException;
import org.springframework.stereotype.Component;

@Component
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {
  private final ObjectMapper objectMapper;

  public JsonSecurityErrorHandler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException ex)
      throws IOException {
    write(response, ErrorCode.UNAUTHORIZED, "Authentication required");
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException ex)
      throws IOException {
    String message = ex instanceof CsrfException
        ? "Missing or invalid anti-forgery token"
        : "Access denied";
    write(response, ErrorCode.FORBIDDEN, message);
  }

  private void write(HttpServletResponse response, ErrorCode code, String message) throws IOException {
    ErrorResponse body = new ErrorResponse(message,
        new ErrorResponse.ErrorBody(code.name(), message, RequestIdFilter.currentRequestId(), null),
        null);
    response.setStatus(code.status().value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
