package com.flint.service;

import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.model.User;
import com.flint.repository.UserRepository;
import java.util.UUID;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Service
public class CurrentUserService {
  private final UserRepository userRepository;

  public CurrentUserService(UserRepository userRepository) {
    this.userRepository = userRepository;
  }

  public UUID requireUserId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken
        || authentication.getPrincipal() == null) {
      throw new ApiException(ErrorCode.UNAUTHORIZED, "Missing authentication");
    }
    Object principal = authentication.getPrincipal();
    if (principal instanceof UUID) {
      return (UUID) principal;
    }
    if (principal instanceof String) {
      String value = (String) principal;
      try {
        return UUID.fromString(value);
      } catch (IllegalArgumentException ex) {
        throw new ApiException(ErrorCode.UNAUTHORIZED, "Invalid authentication");
      }
    }
    throw new ApiException(ErrorCode.UNAUTHORIZED, "Invalid authentication");
  }

  public void requireAdmin(UUID userId) {
    boolean admin = userRepository.findById(userId).map(User::isAdmin).orElse(false);
    if (!admin) {
      throw new ApiException(ErrorCode.FORBIDDEN, "Admin access required");
    }
  }
}
