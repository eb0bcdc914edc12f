package com.warden.api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates management callers by static bearer token.
 *
 * Never rejects on its own: a bad or missing token leaves the request anonymous and the reason in
 * {@link #ATTR_AUTH_ERROR} for the entry point. Dispatch routes stay reachable either way.
 *
 * Not a bean; registered into the security chain only.
 */
public class ManagementTokenFilter extends OncePerRequestFilter {

  public static final String ROLE = "MANAGEMENT";
  public static final String ATTR_AUTH_ERROR = ManagementTokenFilter.class.getName() + ".error";

  static final String MISSING = "Missing bearer token";
  static final String INVALID = "Invalid token";

  private static final String PREFIX = "Bearer ";

  private final byte[] expected;

  public ManagementTokenFilter(ApiProperties props) {
    this.expected = props.hasToken() ? props.token().getBytes(StandardCharsets.UTF_8) : null;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {

    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.startsWith(PREFIX)) {
      request.setAttribute(ATTR_AUTH_ERROR, MISSING);
    } else {
      byte[] presented = header.substring(PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
      if (expected != null && MessageDigest.isEqual(expected, presented)) {
        var auth = new UsernamePasswordAuthenticationToken(
            "management", null, List.of(new SimpleGrantedAuthority("ROLE_" + ROLE)));
        SecurityContextHolder.getContext().setAuthentication(auth);
      } else {
        request.setAttribute(ATTR_AUTH_ERROR, INVALID);
      }
    }
    chain.doFilter(request, response);
  }
}
