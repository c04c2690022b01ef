package com.quantori.csp.api.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node of the molecular graph: a single atom, or a bracket group such as {@code [NH4+]}.
 * <p>
 * Bonds are stored on one endpoint only, see {@link Bond}.
 */
@Getter
@Setter
public class AtomGroup {
  private final int id;
  private final int chainDepth;
  private final Map<String, Integer> elements = new LinkedHashMap<>();
  private final List<Integer> ringDigits = new ArrayList<>();
  private final List<Bond> bonds = new ArrayList<>();
  private int charge;
  private boolean radical;
  /**
   * Mass number shown for the group, either read from the input or filled in from the element table.
   */
  private Integer atomicMass;
  /**
   * True if {@link #atomicMass} was written in the input.
   */
  private boolean isotope;
  private boolean lowercase;
  private boolean implicit;
  private int position;
  private int length;

  public AtomGroup(int id, int chainDepth) {
    this.id = id;
    this.chainDepth = chainDepth;
  }

  public AtomGroup addElement(String symbol) {
    return addElement(symbol, 1);
  }

  public AtomGroup addElement(String symbol, int count) {
    elements.merge(symbol, count, Integer::sum);
    return this;
  }

  public Map<String, Integer> getElements() {
    return Collections.unmodifiableMap(elements);
  }

  public String getFirstElement() {
    return elements.keySet().iterator().next();
  }

  /**
   * Creates a bond from this group to another one.
   *
   * @param type the bond type
   * @param dest the destination group
   * @return false if the destination is this group or this group already stores a bond to it
   */
  public boolean addBond(BondType type, AtomGroup dest) {
    if (dest.id == id || findBond(dest.id).isPresent()) {
      return false;
    }
    bonds.add(new Bond(type, dest.id));
    return true;
  }

  public Optional<Bond> findBond(int dest) {
    return bonds.stream().filter(bond -> bond.getDest() == dest).findFirst();
  }

  public boolean removeBond(int dest) {
    return bonds.removeIf(bond -> bond.getDest() == dest);
  }

  /**
   * Checks if the group consists of a single atom of one of the given elements.
   *
   * @param symbols element symbols
   * @return true if the group is exactly one atom of any of the elements
   */
  public boolean isElement(String... symbols) {
    if (elements.size() != 1 || elements.values().iterator().next() != 1) {
      return false;
    }
    String element = getFirstElement();
    for (String symbol : symbols) {
      if (symbol.equals(element)) {
        return true;
      }
    }
    return false;
  }

  public boolean isOrganicSubset() {
    return elements.size() == 1 && elements.values().iterator().next() == 1 && Element.isOrganic(getFirstElement());
  }

  /**
   * Returns the allowed valences of the group, empty for groups outside the organic subset.
   *
   * @return allowed valences in ascending order
   */
  public int[] getValences() {
    if (!isOrganicSubset()) {
      return new int[0];
    }
    return Element.bySymbol(getFirstElement()).map(Element::getValences).orElseGet(() -> new int[0]);
  }

  public double calculateMr() {
    double mr = 0;
    boolean first = true;
    for (Map.Entry<String, Integer> entry : elements.entrySet()) {
      double mass = first && isotope && atomicMass != null
          ? atomicMass
          : Element.bySymbol(entry.getKey()).map(Element::getAtomicWeight).orElse(0.0);
      mr += mass * entry.getValue();
      first = false;
    }
    return mr;
  }

  /**
   * Returns the elements with their counts, e.g. {@code NH4}.
   *
   * @return the element string
   */
  public String getElementString() {
    StringBuilder builder = new StringBuilder();
    elements.forEach((symbol, count) -> builder.append(symbol).append(count == 1 ? "" : count));
    return builder.toString();
  }

  /**
   * Returns the group as formula text, with element counts as subscripts and the charge as superscript.
   *
   * @param html mark subscripts and superscripts up with {@code sub} and {@code sup} tags
   * @return the formula text
   */
  public String toFormulaString(boolean html) {
    StringBuilder builder = new StringBuilder();
    elements.forEach((symbol, count) -> {
      builder.append(symbol);
      if (count != 1) {
        builder.append(html ? "<sub>" + count + "</sub>" : count);
      }
    });
    if (charge != 0) {
      String chargeString = chargeString(charge);
      builder.append(html ? "<sup>" + chargeString + "</sup>" : chargeString);
    }
    return builder.toString();
  }

  /**
   * Returns the group as written in SMILES, bracketed where the bare form cannot carry the group's data.
   *
   * @return SMILES text of the group
   */
  @Override
  public String toString() {
    String symbol = lowercase ? getFirstElement().toLowerCase() : getFirstElement();
    boolean bare = charge == 0 && !radical && !isotope && elements.size() == 1
        && elements.get(getFirstElement()) == 1
        && (lowercase ? Element.AROMATIC_SHORTHANDS.contains(symbol) : Element.isOrganic(symbol));
    if (bare) {
      return symbol;
    }
    StringBuilder builder = new StringBuilder("[");
    if (isotope && atomicMass != null) {
      builder.append(atomicMass);
    }
    builder.append(symbol);
    boolean first = true;
    for (Map.Entry<String, Integer> entry : elements.entrySet()) {
      if (!first) {
        builder.append(entry.getKey()).append(entry.getValue() == 1 ? "" : entry.getValue());
      }
      first = false;
    }
    if (charge != 0) {
      builder.append(chargeString(charge));
    }
    if (radical) {
      builder.append('.');
    }
    return builder.append(']').toString();
  }

  private static String chargeString(int charge) {
    String sign = charge > 0 ? "+" : "-";
    return Math.abs(charge) == 1 ? sign : sign + Math.abs(charge);
  }
}
