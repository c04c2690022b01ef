package com.quantori.csp.api;

import lombok.Getter;

/**
 * Thrown when path enumeration finds more paths than the caller allowed.
 */
@Getter
public class PathLimitExceededException extends RuntimeException {
  private final int limit;

  public PathLimitExceededException(int start, int end, int limit) {
    super(String.format("more than %d paths between atoms %d and %d", limit, start, end));
    this.limit = limit;
  }
}
