package com.quantori.csp.core.layout;

import com.quantori.csp.api.layout.MoleculeLayout;
import com.quantori.csp.api.layout.PositionData;
import com.quantori.csp.api.layout.PositionData.AtomPosition;
import com.quantori.csp.api.layout.PositionData.RingBounds;
import com.quantori.csp.api.model.AtomGroup;
import com.quantori.csp.api.model.Molecule;
import com.quantori.csp.api.model.Ring;
import com.quantori.csp.api.model.TouchingBond;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference layout: rings become regular polygons, chains zigzag away from the atom they grow from, and
 * disconnected parts are put side by side. Overlaps are not resolved.
 */
@Slf4j
public class SimpleMoleculeLayout implements MoleculeLayout {
  public static final double DEFAULT_BOND_LENGTH = 30;
  public static final double DEFAULT_PADDING = 4;

  private final TextMeasurer measurer;
  private final double bondLength;
  private final double padding;
  private final boolean showImplicits;

  public SimpleMoleculeLayout() {
    this(TextMeasurer.monospace(7, 12), DEFAULT_BOND_LENGTH, DEFAULT_PADDING, false);
  }

  public SimpleMoleculeLayout(TextMeasurer measurer, double bondLength, double padding, boolean showImplicits) {
    this.measurer = measurer;
    this.bondLength = bondLength;
    this.padding = padding;
    this.showImplicits = showImplicits;
  }

  @Override
  public PositionData layout(Molecule molecule) {
    Map<Integer, Point> points = new LinkedHashMap<>();
    double offsetX = 0;
    for (int id : molecule.getGroups().keySet()) {
      if (!isVisible(molecule, id) || points.containsKey(id)) {
        continue;
      }
      Map<Integer, Point> component = placeComponent(molecule, id);
      double minX = component.values().stream().mapToDouble(Point::x).min().orElse(0);
      double maxX = component.values().stream().mapToDouble(Point::x).max().orElse(0);
      double shift = offsetX - minX;
      component.forEach((atom, point) -> points.put(atom, new Point(point.x() + shift, point.y())));
      offsetX += maxX - minX + bondLength;
    }

    Map<Integer, AtomPosition> boxes = new LinkedHashMap<>();
    double minX = Double.MAX_VALUE;
    double minY = Double.MAX_VALUE;
    for (Map.Entry<Integer, Point> entry : points.entrySet()) {
      TextMeasurer.TextBox box = measurer.measure(molecule.getGroup(entry.getKey()).toFormulaString(false));
      Point point = entry.getValue();
      boxes.put(entry.getKey(), new AtomPosition(point.x(), point.y(), box.width(), box.height()));
      minX = Math.min(minX, point.x() - box.width() / 2);
      minY = Math.min(minY, point.y() - box.height() / 2);
    }
    if (boxes.isEmpty()) {
      return new PositionData(Map.of(), Map.of(), 0, 0);
    }

    double shiftX = padding - minX;
    double shiftY = padding - minY;
    Map<Integer, AtomPosition> atoms = new LinkedHashMap<>();
    double width = 0;
    double height = 0;
    for (Map.Entry<Integer, AtomPosition> entry : boxes.entrySet()) {
      AtomPosition box = entry.getValue();
      AtomPosition moved = new AtomPosition(box.x() + shiftX, box.y() + shiftY, box.width(), box.height());
      atoms.put(entry.getKey(), moved);
      width = Math.max(width, moved.x() + moved.width() / 2 + padding);
      height = Math.max(height, moved.y() + moved.height() / 2 + padding);
    }

    Map<Integer, RingBounds> rings = new LinkedHashMap<>();
    for (Ring ring : molecule.getRings()) {
      List<AtomPosition> members = ring.getMembers().stream().filter(atoms::containsKey).map(atoms::get).toList();
      if (!members.isEmpty()) {
        rings.put(ring.getId(), new RingBounds(
            members.stream().mapToDouble(AtomPosition::x).min().orElse(0),
            members.stream().mapToDouble(AtomPosition::x).max().orElse(0),
            members.stream().mapToDouble(AtomPosition::y).min().orElse(0),
            members.stream().mapToDouble(AtomPosition::y).max().orElse(0)));
      }
    }
    log.debug("Laid out {} atoms and {} rings in {}x{}", atoms.size(), rings.size(), width, height);
    return new PositionData(atoms, rings, width, height);
  }

  private boolean isVisible(Molecule molecule, int id) {
    return molecule.containsGroup(id) && (showImplicits || !molecule.getGroup(id).isImplicit());
  }

  private Map<Integer, Point> placeComponent(Molecule molecule, int root) {
    Map<Integer, Point> placed = new LinkedHashMap<>();
    Map<Integer, Double> headings = new HashMap<>();
    Map<Integer, Integer> turns = new HashMap<>();
    Deque<Integer> queue = new ArrayDeque<>();
    placed.put(root, new Point(0, 0));
    headings.put(root, 0.0);
    turns.put(root, 1);
    queue.add(root);

    while (!queue.isEmpty()) {
      int atom = queue.poll();
      for (Ring ring : molecule.getRings()) {
        if (ring.getMembers().contains(atom) && ring.getMembers().stream().anyMatch(id -> !placed.containsKey(id))) {
          placeRing(molecule, ring, atom, placed, headings, turns, queue);
        }
      }

      List<Integer> neighbors = new ArrayList<>();
      for (TouchingBond bond : molecule.getAllBonds(atom)) {
        if (isVisible(molecule, bond.neighbor()) && !placed.containsKey(bond.neighbor())) {
          neighbors.add(bond.neighbor());
        }
      }
      Point origin = placed.get(atom);
      double heading = headings.get(atom);
      int turn = turns.get(atom);
      for (int i = 0; i < neighbors.size(); i++) {
        double angle;
        if (neighbors.size() == 1) {
          angle = heading + turn * Math.PI / 3;
        } else {
          angle = heading - Math.PI / 3 + i * (2 * Math.PI / 3) / (neighbors.size() - 1);
        }
        int neighbor = neighbors.get(i);
        placed.put(neighbor, origin.move(angle, bondLength));
        headings.put(neighbor, angle);
        turns.put(neighbor, -turn);
        queue.add(neighbor);
      }
    }
    return placed;
  }

  private void placeRing(Molecule molecule, Ring ring, int anchor, Map<Integer, Point> placed,
      Map<Integer, Double> headings, Map<Integer, Integer> turns, Deque<Integer> queue) {
    List<Integer> members = ring.getMembers();
    int size = members.size();
    int anchorIndex = members.indexOf(anchor);
    double radius = bondLength / (2 * Math.sin(Math.PI / size));
    double heading = headings.get(anchor);
    Point center = placed.get(anchor).move(heading, radius);
    double start = heading + Math.PI;
    for (int k = 1; k < size; k++) {
      int member = members.get((anchorIndex + k) % size);
      if (placed.containsKey(member) || !isVisible(molecule, member)) {
        continue;
      }
      double angle = start + 2 * Math.PI * k / size;
      placed.put(member, center.move(angle, radius));
      headings.put(member, angle);
      turns.put(member, 1);
      queue.add(member);
    }
  }

  private record Point(double x, double y) {

    Point move(double angle, double distance) {
      return new Point(x + Math.cos(angle) * distance, y + Math.sin(angle) * distance);
    }
  }
}
