package com.quantori.ceb.core.counter;

import com.quantori.ceb.api.model.AtomCount;
import com.quantori.ceb.api.model.Group;
import com.quantori.ceb.api.model.Molecule;
import com.quantori.ceb.api.model.ParseNode;
import com.quantori.ceb.api.model.RepeatedAtom;
import com.quantori.ceb.api.model.SingleAtom;
import com.quantori.ceb.api.service.AtomCounter;
import java.util.List;
import java.util.Objects;

/**
 * Folds a formula parse tree into element counts. Group counts are the sum of their members multiplied by the
 * group multiplier, applied recursively.
 */
public class TreeAtomCounter implements AtomCounter {

  @Override
  public AtomCount countAtoms(ParseNode node) {
    Objects.requireNonNull(node, "node");
    if (node instanceof SingleAtom atom) {
      return AtomCount.of(atom.symbol(), 1);
    } else if (node instanceof RepeatedAtom atom) {
      return AtomCount.of(atom.symbol(), atom.count());
    } else if (node instanceof Group group) {
      return sum(group.children()).times(group.multiplier());
    } else if (node instanceof Molecule molecule) {
      return sum(molecule.children());
    }
    throw new IllegalArgumentException("Unsupported parse node " + node.getClass().getName());
  }

  private AtomCount sum(List<ParseNode> children) {
    var total = AtomCount.empty();
    for (ParseNode child : children) {
      total = total.plus(countAtoms(child));
    }
    return total;
  }
}
