package com.quantori.csp.core.parser;

import com.quantori.csp.api.model.AtomGroup;
import com.quantori.csp.api.model.BondType;
import com.quantori.csp.api.model.Element;
import com.quantori.csp.api.model.ParseOptions;
import com.quantori.csp.api.model.ParseResult;
import com.quantori.csp.api.model.Ring;
import com.quantori.csp.core.parser.SmilesTokens.BracketAtom;
import com.quantori.csp.core.parser.SmilesTokens.DigitRun;
import com.quantori.csp.core.parser.SmilesTokens.Extraction;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive descent over one input. A chain is read left to right; every branch is parsed by a recursive call over
 * the text between its parentheses.
 * <p>
 * One instance parses one input and is not reused.
 */
class ChainParser {
  private final ParseResult result;
  private final ParseOptions options;
  private final RingRegistry rings = new RingRegistry();

  ChainParser(ParseResult result) {
    this.result = result;
    this.options = result.getOptions();
  }

  void parse() {
    parseChain(result.getSmiles(), new ArrayList<>(), null, 0, 0);
  }

  private void parseChain(String text, List<AtomGroup> chain, AtomGroup parent, int depth, int offset) {
    try {
      readChain(text, chain, parent, depth, offset);
    } catch (ParseDiagnostic diagnostic) {
      throw diagnostic.withContext(String.format("Error whilst parsing SMILES string \"%s\" (chain depth %d):",
          text, depth));
    }
  }

  private void readChain(String text, List<AtomGroup> chain, AtomGroup parent, int depth, int offset) {
    if (depth > options.getMaxBranchDepth()) {
      throw ParseDiagnostic.syntax("branches nested deeper than " + options.getMaxBranchDepth(), "(", offset - 1);
    }
    BondType pendingBond = null;
    int pendingBondColumn = -1;
    boolean dontBondNext = false;

    int pos = 0;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      int column = offset + pos;

      if (c == '.' && depth == 0 && options.isEnableDisconnectedStructures()) {
        if (dontBondNext || chain.isEmpty() || pos == text.length() - 1) {
          throw ParseDiagnostic.syntax("expected SMILES, got separator '.'", ".", column);
        }
        dontBondNext = true;
        result.startMolecule();
        pos++;
        continue;
      }

      if (c == '>' && depth == 0 && !chain.isEmpty() && acceptsReactionArrow()) {
        int index = result.getMolecules().size() - 1;
        dontBondNext = true;
        if (result.currentMolecule().isEmpty()) {
          index--;
        } else {
          result.startMolecule();
        }
        result.addReactionIndex(index);
        pos++;
        continue;
      }

      BondType bondType = c == ':' && !options.isEnableAromaticBonds() ? null : explicitBond(c);
      if (bondType != null) {
        if (pendingBond != null) {
          throw ParseDiagnostic.syntax("unexpected bond '" + c + "' after bond '" + pendingBond.getSymbol() + "'",
              String.valueOf(c), column);
        }
        pendingBond = bondType;
        pendingBondColumn = column;
        pos++;
        if (pos >= text.length()) {
          throw ParseDiagnostic.syntax(String.format("invalid bond '%s': unexpected end-of-input after bond", c),
              String.valueOf(c), column);
        }
        if (bondType == BondType.AROMATIC) {
          markOpenRingsAromatic(column);
        }
        continue;
      }

      if (c == '{' && options.isEnableChargeClauses()) {
        pos += readChargeClause(text, pos, chain, column);
        continue;
      }

      if (c == '[' && options.isEnableBracketAtoms()) {
        Extraction extraction = SmilesTokens.extractBetweenMatching(text, '[', ']', pos);
        if (!extraction.isBalanced()) {
          throw ParseDiagnostic.syntax(String.format("unmatched closing bracket at position %d '['", column),
              text.substring(pos), column);
        }
        chain.add(createBracketGroup(extraction, depth, column));
        pos += extraction.length();
      } else if (c == '(' && options.isEnableBranches()) {
        pos += readBranch(text, pos, chain, depth, column);
        continue;
      } else if (SmilesTokens.isDigitStart(c) && options.isEnableRings()) {
        pos += readRingDigits(text, pos, chain, column);
        continue;
      } else {
        String symbol = SmilesTokens.extractElement(text, pos, column);
        chain.add(createBareGroup(symbol, depth, column));
        pos += symbol.length();
      }

      // bonding
      if (dontBondNext) {
        if (pendingBond != null) {
          throw ParseDiagnostic.bond("attempted to create bond between separated structures",
              pendingBond.getSymbol(), pendingBondColumn);
        }
        dontBondNext = false;
      } else {
        bondLastAtom(chain, parent, pendingBond, pendingBond == null ? column : pendingBondColumn);
      }
      pendingBond = null;
      rings.appendAtom(chain.get(chain.size() - 1).getId());
    }

    if (pendingBond != null) {
      throw ParseDiagnostic.syntax("bond '" + pendingBond.getSymbol() + "' is not followed by an atom",
          pendingBond.getSymbol(), pendingBondColumn);
    }
  }

  private boolean acceptsReactionArrow() {
    return options.isEnableDisconnectedStructures() && options.isEnableReactions()
        && (options.isEnableMultipleReactions() || result.getReactionIndexes().size() < 2);
  }

  private static BondType explicitBond(char c) {
    return BondType.fromSymbol(c).filter(type -> type != BondType.DEFAULT).orElse(null);
  }

  private void markOpenRingsAromatic(int column) {
    if (rings.isEmpty()) {
      throw ParseDiagnostic.bond("aromatic bond ':' only valid in rings", ":", column);
    }
    for (Ring ring : rings.openRings()) {
      if (Boolean.FALSE.equals(ring.getAromatic())) {
        throw ParseDiagnostic.bond("aromatic bond ':' only valid in aromatic rings", ":", column);
      }
      ring.setAromatic(true);
    }
  }

  private int readChargeClause(String text, int pos, List<AtomGroup> chain, int column) {
    Extraction extraction = SmilesTokens.extractBetweenMatching(text, '{', '}', pos);
    if (!extraction.isBalanced()) {
      throw ParseDiagnostic.syntax(String.format("unmatched closing brace at position %d '{'", column),
          text.substring(pos), column);
    }
    String clause = "{" + extraction.extracted() + "}";
    if (chain.isEmpty()) {
      throw ParseDiagnostic.syntax("unexpected charge clause", clause, column);
    }
    AtomGroup group = chain.get(chain.size() - 1);
    if ((group.getCharge() != 0 && !options.isCumulativeCharge()) || group.isRadical()) {
      throw ParseDiagnostic.syntax("unexpected charge clause", clause, column);
    }
    int charge = SmilesTokens.parseCharge(extraction.extracted()).orElseThrow(() -> ParseDiagnostic.syntax(
        "invalid charge string. Expected a sign run such as '++' or a signed number such as '+2' or '2+'",
        extraction.extracted(), column + 1));
    group.setCharge(group.getCharge() + charge);
    group.setLength(group.getLength() + extraction.length());
    return extraction.length();
  }

  private AtomGroup createBracketGroup(Extraction extraction, int depth, int column) {
    BracketAtom atom;
    try {
      atom = SmilesTokens.parseBracketBody(extraction.extracted(), column + 1, options.isEnableRadicals());
    } catch (ParseDiagnostic diagnostic) {
      throw diagnostic.withContext(String.format("Error whilst parsing inorganic group \"[%s]\":",
          extraction.extracted()));
    }
    AtomGroup group = result.createGroup(depth);
    group.addElement(atom.symbol());
    if (atom.hydrogens() > 0) {
      group.addElement("H", atom.hydrogens());
    }
    group.setCharge(atom.charge());
    group.setRadical(atom.radical());
    group.setLowercase(atom.lowercase());
    if (atom.mass() != null) {
      group.setAtomicMass(atom.mass());
      group.setIsotope(true);
    } else if (options.isShowImplicitAtomicMass()) {
      group.setAtomicMass(nominalMass(atom.symbol()));
    }
    group.setPosition(column);
    group.setLength(extraction.length());
    result.registerGroup(result.currentMolecule(), group);
    return group;
  }

  private AtomGroup createBareGroup(String symbol, int depth, int column) {
    AtomGroup group = result.createGroup(depth);
    boolean lowercase = Character.isLowerCase(symbol.charAt(0));
    String element = lowercase ? StringUtils.capitalize(symbol) : symbol;
    group.addElement(element);
    group.setLowercase(lowercase);
    if (options.isShowImplicitAtomicMass()) {
      group.setAtomicMass(nominalMass(element));
    }
    group.setPosition(column);
    group.setLength(symbol.length());
    result.registerGroup(result.currentMolecule(), group);
    return group;
  }

  private static Integer nominalMass(String symbol) {
    return Element.bySymbol(symbol).map(Element::getNominalMass).orElse(null);
  }

  private int readBranch(String text, int pos, List<AtomGroup> chain, int depth, int column) {
    Extraction extraction = SmilesTokens.extractBetweenMatching(text, '(', ')', pos);
    if (!extraction.isBalanced()) {
      throw ParseDiagnostic.syntax(String.format("unmatched closing parenthesis at position %d '('", column),
          text.substring(pos), column);
    }
    if (extraction.extracted().isEmpty()) {
      throw ParseDiagnostic.syntax(String.format("Empty chain at position %d", column), "()", column);
    }
    if (chain.isEmpty()) {
      throw ParseDiagnostic.syntax("unexpected SMILES chain (no parent could be found)",
          "(" + extraction.extracted() + ")", column);
    }
    try {
      parseChain(extraction.extracted(), new ArrayList<>(), chain.get(chain.size() - 1), depth + 1, column + 1);
    } catch (ParseDiagnostic diagnostic) {
      throw diagnostic.withContext(String.format("Error whilst parsing chain \"(%s)\" at position %d:",
          extraction.extracted(), column));
    }
    return extraction.length();
  }

  private int readRingDigits(String text, int pos, List<AtomGroup> chain, int column) {
    if (chain.isEmpty()) {
      throw ParseDiagnostic.syntax("unexpected ring digit", String.valueOf(text.charAt(pos)), column);
    }
    DigitRun run = SmilesTokens.parseDigitString(text, pos);
    String extracted = text.substring(pos, pos + run.length());
    if (!run.valid() || run.digits().isEmpty()) {
      throw ParseDiagnostic.syntax("invalid syntax", extracted, column);
    }
    Set<Integer> seen = new HashSet<>();
    List<Integer> duplicates = run.digits().stream().filter(digit -> !seen.add(digit)).distinct()
        .collect(Collectors.toList());
    if (!duplicates.isEmpty()) {
      throw ParseDiagnostic.syntax("duplicate ring endings found: " + StringUtils.join(duplicates, ", "),
          extracted, column);
    }

    AtomGroup group = chain.get(chain.size() - 1);
    group.getRingDigits().addAll(run.digits());
    for (int digit : run.digits()) {
      if (rings.isOpen(digit)) {
        rings.close(digit, group.getId());
      } else {
        Ring ring = result.createRing(digit, group.getId());
        ring.getMembers().add(group.getId());
        if (group.isLowercase()) {
          ring.setAromatic(true);
        }
        rings.open(ring);
        result.registerRing(ring);
        result.currentMolecule().addRing(ring);
      }
    }
    return run.length();
  }

  private void bondLastAtom(List<AtomGroup> chain, AtomGroup parent, BondType explicit, int column) {
    BondType type = explicit == null ? BondType.DEFAULT : explicit;
    String kind = explicit == null ? "implicit" : "explicit";
    AtomGroup last = chain.get(chain.size() - 1);
    AtomGroup previous;
    String role;
    if (chain.size() >= 2) {
      previous = chain.get(chain.size() - 2);
      role = "last atom";
    } else if (parent != null) {
      previous = parent;
      role = "chain parent atom";
    } else if (explicit != null) {
      throw ParseDiagnostic.syntax("unexpected bond '" + explicit.getSymbol() + "'", explicit.getSymbol(), column);
    } else {
      return;
    }
    if (!previous.addBond(type, last)) {
      throw ParseDiagnostic.bond(String.format("attempted to create %s bond between this (%s) and %s (%s)",
          kind, last, role, previous), explicit == null ? last.toString() : explicit.getSymbol(), column);
    }
  }
}
