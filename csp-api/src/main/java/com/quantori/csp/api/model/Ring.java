package com.quantori.csp.api.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A ring closed by a pair of equal ring digits.
 * <p>
 * While parsing, {@link #getMembers()} collects every atom read while the digit was open. After parsing the list is
 * replaced by the resolved cycle, starting at the atom where the digit first appeared.
 */
@Getter
@Setter
@ToString
public class Ring {
  private final int id;
  private final int digit;
  private final int start;
  private Integer end;
  /**
   * Unknown ({@code null}) until the first atom after the opening one is read.
   */
  private Boolean aromatic;
  private List<Integer> members = new ArrayList<>();

  public Ring(int id, int digit, int start) {
    this.id = id;
    this.digit = digit;
    this.start = start;
  }

  public boolean isClosed() {
    return end != null;
  }

  public boolean isAromatic() {
    return Boolean.TRUE.equals(aromatic);
  }

  public int size() {
    return members.size();
  }
}
