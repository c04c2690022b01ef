package com.quantori.csp.api.util;

import com.quantori.csp.api.model.AtomCount;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Set of utilities to assemble chemical formulas from atom counts.
 */
@UtilityClass
public final class FormulaUtilities {

  /**
   * Assemble a molecular formula. Groups made of several atoms are parenthesized when they occur more than once,
   * e.g. {@code (NH4)2}.
   *
   * @param counts atom counts in output order
   * @param html   mark counts up as subscripts
   * @return the formula
   */
  public static String assembleMolecularFormula(List<AtomCount> counts, boolean html) {
    StringBuilder formula = new StringBuilder();
    for (AtomCount count : counts) {
      String atom = subscriptDigits(count.atom(), html);
      if (count.count() > 1 && isCompound(count.atom())) {
        formula.append('(').append(atom).append(')');
      } else {
        formula.append(atom);
      }
      formula.append(countText(count.count(), html));
    }
    return formula.toString();
  }

  /**
   * Assemble an empirical formula: element counts divided by their greatest common divisor.
   *
   * @param counts element counts in output order
   * @param html   mark counts up as subscripts
   * @return the formula
   */
  public static String assembleEmpiricalFormula(List<AtomCount> counts, boolean html) {
    int divisor = counts.stream().mapToInt(AtomCount::count).reduce(0, FormulaUtilities::gcd);
    StringBuilder formula = new StringBuilder();
    for (AtomCount count : counts) {
      formula.append(count.atom()).append(countText(count.count() / Math.max(divisor, 1), html));
    }
    return formula.toString();
  }

  /**
   * Write one unit of a condensed formula. A repeated entry other than the first or the last is parenthesized,
   * e.g. {@code C(CH3)3} is written by units {@code C} and {@code (CH3)3}.
   *
   * @param unit formula texts of the unit's groups with their counts, the central group first
   * @param html mark counts up as subscripts
   * @return the unit text
   */
  public static String condensedUnit(Map<String, Integer> unit, boolean html) {
    StringBuilder text = new StringBuilder();
    int index = 0;
    for (Map.Entry<String, Integer> entry : unit.entrySet()) {
      String part = entry.getKey() + countText(entry.getValue(), html);
      boolean middle = index > 0 && index < unit.size() - 1;
      text.append(middle && entry.getValue() > 1 ? "(" + part + ")" : part);
      index++;
    }
    return text.toString();
  }

  /**
   * Collapse runs of equal units, e.g. {@code CH3, CH2, CH2, CH3} into {@code CH3(CH2)2CH3}.
   *
   * @param units condensed formula units
   * @param html  mark counts up as subscripts
   * @return the joined units
   */
  public static String collapseRepeats(List<String> units, boolean html) {
    List<String> collapsed = new ArrayList<>();
    int i = 0;
    while (i < units.size()) {
      int run = 1;
      while (i + run < units.size() && units.get(i + run).equals(units.get(i))) {
        run++;
      }
      collapsed.add(run > 1 ? "(" + units.get(i) + ")" + countText(run, html) : units.get(i));
      i += run;
    }
    return String.join("", collapsed);
  }

  private static String countText(int count, boolean html) {
    if (count == 1) {
      return "";
    }
    return html ? "<sub>" + count + "</sub>" : String.valueOf(count);
  }

  private static String subscriptDigits(String atom, boolean html) {
    return html ? atom.replaceAll("(\\d+)", "<sub>$1</sub>") : atom;
  }

  private static boolean isCompound(String atom) {
    return StringUtils.isNotEmpty(StringUtils.getDigits(atom))
        || atom.chars().filter(Character::isUpperCase).count() > 1;
  }

  private static int gcd(int a, int b) {
    return b == 0 ? a : gcd(b, a % b);
  }
}
