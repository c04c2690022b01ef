package com.quantori.csp.api.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Writes a molecule as SMILES.
 * <p>
 * A depth first search builds a spanning tree, multiple bonds first so they end up as tree edges. Every remaining
 * bond is written as a ring closure digit; digits are reused once closed. The text is assembled bottom-up, every
 * child but the last one in parentheses.
 */
final class SmilesWriter {
  private static final int MAX_DIGIT = 99;

  private final Molecule molecule;
  private final boolean showImplicits;
  private final List<Integer> order = new ArrayList<>();
  private final Map<Integer, Integer> parents = new HashMap<>();
  private final Map<Integer, BondType> parentBonds = new HashMap<>();
  private final Map<Integer, List<Integer>> children = new HashMap<>();
  // atom -> closures it takes part in, in discovery order
  private final Map<Integer, List<Integer>> closures = new HashMap<>();
  private int closureCount;

  SmilesWriter(Molecule molecule, boolean showImplicits) {
    this.molecule = molecule;
    this.showImplicits = showImplicits;
  }

  String write() {
    StringJoiner components = new StringJoiner(".");
    Set<Integer> visited = new HashSet<>();
    for (AtomGroup group : molecule.getGroups().values()) {
      if (isVisible(group.getId()) && !visited.contains(group.getId())) {
        int start = order.size();
        buildTree(group.getId(), visited);
        List<Integer> component = order.subList(start, order.size());
        components.add(assemble(component, assignDigits(component)));
      }
    }
    return components.toString();
  }

  private boolean isVisible(int id) {
    return molecule.containsGroup(id) && (showImplicits || !molecule.getGroup(id).isImplicit());
  }

  private List<TouchingBond> sortedBonds(int id) {
    List<TouchingBond> bonds = molecule.getAllBonds(id);
    bonds.sort(Comparator.comparingInt(
        (TouchingBond bond) -> bond.type() == BondType.DOUBLE || bond.type() == BondType.TRIPLE ? 0 : 1));
    return bonds;
  }

  private void buildTree(int root, Set<Integer> visited) {
    Set<Integer> onStack = new HashSet<>();
    Deque<Frame> stack = new ArrayDeque<>();
    visited.add(root);
    onStack.add(root);
    order.add(root);
    stack.push(new Frame(root, sortedBonds(root)));

    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.cursor >= frame.bonds.size()) {
        stack.pop();
        onStack.remove(frame.atom);
        continue;
      }
      TouchingBond bond = frame.bonds.get(frame.cursor++);
      int neighbor = bond.neighbor();
      if (!isVisible(neighbor)) {
        continue;
      }
      if (!visited.contains(neighbor)) {
        visited.add(neighbor);
        onStack.add(neighbor);
        order.add(neighbor);
        parents.put(neighbor, frame.atom);
        parentBonds.put(neighbor, bond.type());
        children.computeIfAbsent(frame.atom, key -> new ArrayList<>()).add(neighbor);
        stack.push(new Frame(neighbor, sortedBonds(neighbor)));
      } else if (onStack.contains(neighbor) && !Objects.equals(parents.get(frame.atom), neighbor)) {
        int closure = closureCount++;
        closures.computeIfAbsent(neighbor, key -> new ArrayList<>()).add(closure);
        closures.computeIfAbsent(frame.atom, key -> new ArrayList<>()).add(closure);
      }
    }
  }

  private Map<Integer, String> assignDigits(List<Integer> atoms) {
    Map<Integer, String> digitText = new HashMap<>();
    Map<Integer, Integer> closureDigits = new HashMap<>();
    boolean[] inUse = new boolean[MAX_DIGIT + 1];
    for (int atom : atoms) {
      StringBuilder text = new StringBuilder();
      List<Integer> released = new ArrayList<>();
      for (int closure : closures.getOrDefault(atom, List.of())) {
        Integer digit = closureDigits.get(closure);
        if (digit == null) {
          digit = lowestFree(inUse);
          inUse[digit] = true;
          closureDigits.put(closure, digit);
        } else {
          released.add(digit);
        }
        text.append(digit > 9 ? "%" + digit : String.valueOf(digit));
      }
      released.forEach(digit -> inUse[digit] = false);
      digitText.put(atom, text.toString());
    }
    return digitText;
  }

  private static int lowestFree(boolean[] inUse) {
    for (int digit = 1; digit <= MAX_DIGIT; digit++) {
      if (!inUse[digit]) {
        return digit;
      }
    }
    throw new IllegalStateException("More than " + MAX_DIGIT + " rings open at once");
  }

  private String assemble(List<Integer> atoms, Map<Integer, String> digitText) {
    Map<Integer, String> text = new HashMap<>();
    for (int i = atoms.size() - 1; i >= 0; i--) {
      int atom = atoms.get(i);
      StringBuilder builder = new StringBuilder(bondSymbol(atom))
          .append(molecule.getGroup(atom))
          .append(digitText.get(atom));
      List<Integer> kids = children.getOrDefault(atom, List.of());
      for (int k = 0; k < kids.size(); k++) {
        String child = text.remove(kids.get(k));
        builder.append(k < kids.size() - 1 ? "(" + child + ")" : child);
      }
      text.put(atom, builder.toString());
    }
    return text.get(atoms.get(0));
  }

  private String bondSymbol(int atom) {
    BondType type = parentBonds.get(atom);
    if (type == null) {
      return "";
    }
    if (type == BondType.AROMATIC && molecule.getGroup(atom).isLowercase()
        && molecule.getGroup(parents.get(atom)).isLowercase()) {
      return "";
    }
    return type.getSymbol();
  }

  private static final class Frame {
    private final int atom;
    private final List<TouchingBond> bonds;
    private int cursor;

    private Frame(int atom, List<TouchingBond> bonds) {
      this.atom = atom;
      this.bonds = bonds;
    }
  }
}
