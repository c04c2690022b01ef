package com.quantori.csp.core.parser;

import com.quantori.csp.api.model.Element;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Recognizers for the tokens of the SMILES grammar. Each one reads from a position of the text and either consumes a
 * prefix or reports that nothing matched.
 */
@UtilityClass
class SmilesTokens {
  private static final String ORGANIC_LIST = "B,C,N,O,P,S,F,Cl,Br,I";
  private static final String AROMATIC_LIST = "b,c,n,o,p,s,se,as";
  private static final int MAX_COUNT_DIGITS = 3;

  /**
   * Text between an opening delimiter and its matching closing one.
   *
   * @param extracted text inside the delimiters, the rest of the input if they are unbalanced
   * @param openCount nesting depth left when the input ended, 0 if balanced
   */
  record Extraction(String extracted, int openCount) {

    boolean isBalanced() {
      return openCount == 0;
    }

    int length() {
      return extracted.length() + 2;
    }
  }

  /**
   * Ring closure digits read from one position.
   *
   * @param digits the digits, {@code %NN} read as one number
   * @param length number of characters consumed
   * @param valid  false if a {@code %} is not followed by two digits
   */
  record DigitRun(List<Integer> digits, int length, boolean valid) {
  }

  /**
   * Contents of a bracket atom such as {@code [13CH4]} or {@code [NH4+]}.
   */
  record BracketAtom(Integer mass, String symbol, boolean lowercase, int hydrogens, int charge, boolean radical) {
  }

  static Extraction extractBetweenMatching(String text, char open, char close, int start) {
    int depth = 0;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == open) {
        depth++;
      } else if (c == close) {
        depth--;
        if (depth == 0) {
          return new Extraction(text.substring(start + 1, i), 0);
        }
      }
    }
    return new Extraction(text.substring(Math.min(start + 1, text.length())), depth);
  }

  static boolean isDigitStart(char c) {
    return Character.isDigit(c) || c == '%';
  }

  static DigitRun parseDigitString(String text, int start) {
    List<Integer> digits = new ArrayList<>();
    int i = start;
    while (i < text.length() && isDigitStart(text.charAt(i))) {
      if (text.charAt(i) == '%') {
        if (i + 2 >= text.length() || !Character.isDigit(text.charAt(i + 1))
            || !Character.isDigit(text.charAt(i + 2))) {
          return new DigitRun(digits, i - start + 1, false);
        }
        digits.add(Integer.parseInt(text.substring(i + 1, i + 3)));
        i += 3;
      } else {
        digits.add(text.charAt(i) - '0');
        i++;
      }
    }
    return new DigitRun(digits, i - start, true);
  }

  /**
   * Parses a charge: a run of one sign ({@code +}, {@code ++}, {@code -}), or a number with a leading or trailing
   * sign ({@code +2}, {@code 2+}).
   *
   * @param text the charge text
   * @return the charge, empty if the text is not a charge
   */
  static OptionalInt parseCharge(String text) {
    if (StringUtils.isEmpty(text)) {
      return OptionalInt.empty();
    }
    if (StringUtils.containsOnly(text, '+')) {
      return OptionalInt.of(text.length());
    }
    if (StringUtils.containsOnly(text, '-')) {
      return OptionalInt.of(-text.length());
    }
    char first = text.charAt(0);
    char last = text.charAt(text.length() - 1);
    String number;
    char sign;
    if (first == '+' || first == '-') {
      sign = first;
      number = text.substring(1);
    } else if (last == '+' || last == '-') {
      sign = last;
      number = text.substring(0, text.length() - 1);
    } else {
      return OptionalInt.empty();
    }
    if (!StringUtils.isNumeric(number) || number.length() > MAX_COUNT_DIGITS) {
      return OptionalInt.empty();
    }
    int value = Integer.parseInt(number);
    return OptionalInt.of(sign == '-' ? -value : value);
  }

  /**
   * Reads a bare atom: the longest of a two letter organic element, a one letter organic element or an aromatic
   * shorthand.
   *
   * @param text   the input
   * @param start  position of the atom
   * @param column column of {@code start} in the whole input
   * @return the symbol as written
   * @throws ParseDiagnostic if no bare atom starts at the position
   */
  static String extractElement(String text, int start, int column) {
    String two = start + 2 <= text.length() ? text.substring(start, start + 2) : null;
    String one = text.substring(start, start + 1);
    if (two != null && (Element.isOrganic(two) || Element.AROMATIC_SHORTHANDS.contains(two))) {
      return two;
    }
    if (Element.isOrganic(one) || Element.AROMATIC_SHORTHANDS.contains(one)) {
      return one;
    }
    String element = two != null && Element.isElement(two) ? two : one;
    if (Element.isElement(element)) {
      throw ParseDiagnostic.syntax(String.format("expected organic element [%s] or aromatic ring element [%s], got '%s'",
          ORGANIC_LIST, AROMATIC_LIST, element), element, column);
    }
    throw ParseDiagnostic.syntax(String.format("position %d: expected atom, got '%s'", column, one), one, column);
  }

  /**
   * Parses the body of a bracket atom: an optional mass, an element symbol, an optional hydrogen count, an optional
   * charge and an optional radical marker.
   *
   * @param body           text between the brackets
   * @param column         column of the first body character in the whole input
   * @param enableRadicals accept the radical marker
   * @return the atom
   * @throws ParseDiagnostic if the body is malformed
   */
  static BracketAtom parseBracketBody(String body, int column, boolean enableRadicals) {
    int i = 0;
    while (i < body.length() && Character.isDigit(body.charAt(i))) {
      i++;
    }
    if (i > MAX_COUNT_DIGITS) {
      throw ParseDiagnostic.syntax("invalid isotope mass '" + body.substring(0, i) + "'", body.substring(0, i),
          column);
    }
    Integer mass = i > 0 ? Integer.valueOf(body.substring(0, i)) : null;

    String symbol = readBracketElement(body, i);
    if (symbol == null) {
      String rest = i < body.length() ? body.substring(i) : "]";
      throw ParseDiagnostic.syntax("expected element", rest, column + i);
    }
    boolean lowercase = Character.isLowerCase(symbol.charAt(0));
    i += symbol.length();

    int hydrogens = 0;
    if (i < body.length() && body.charAt(i) == 'H') {
      i++;
      int digitsStart = i;
      while (i < body.length() && Character.isDigit(body.charAt(i))) {
        i++;
      }
      if (i - digitsStart > MAX_COUNT_DIGITS) {
        throw ParseDiagnostic.syntax("invalid hydrogen count '" + body.substring(digitsStart, i) + "'",
            body.substring(digitsStart, i), column + digitsStart);
      }
      hydrogens = i > digitsStart ? Integer.parseInt(body.substring(digitsStart, i)) : 1;
    }

    int charge = 0;
    int chargeStart = i;
    while (i < body.length() && (body.charAt(i) == '+' || body.charAt(i) == '-' || Character.isDigit(body.charAt(i)))) {
      i++;
    }
    if (i > chargeStart) {
      String chargeText = body.substring(chargeStart, i);
      OptionalInt parsed = parseCharge(chargeText);
      if (parsed.isEmpty()) {
        throw ParseDiagnostic.syntax("invalid charge '" + chargeText + "'", chargeText, column + chargeStart);
      }
      charge = parsed.getAsInt();
    }

    boolean radical = false;
    if (i < body.length() && body.charAt(i) == '.') {
      if (!enableRadicals) {
        throw ParseDiagnostic.syntax("radicals are not enabled", ".", column + i);
      }
      radical = true;
      i++;
    }

    if (i < body.length()) {
      throw ParseDiagnostic.syntax("unexpected character '" + body.charAt(i) + "'", body.substring(i), column + i);
    }
    return new BracketAtom(mass, lowercase ? StringUtils.capitalize(symbol) : symbol, lowercase, hydrogens, charge,
        radical);
  }

  private static String readBracketElement(String body, int start) {
    if (start >= body.length()) {
      return null;
    }
    if (start + 2 <= body.length()) {
      String two = body.substring(start, start + 2);
      if (Element.isElement(two) || Element.AROMATIC_SHORTHANDS.contains(two)) {
        return two;
      }
    }
    String one = body.substring(start, start + 1);
    return Element.isElement(one) || Element.AROMATIC_SHORTHANDS.contains(one) ? one : null;
  }
}
