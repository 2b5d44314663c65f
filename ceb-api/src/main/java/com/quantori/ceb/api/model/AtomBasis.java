package com.quantori.ceb.api.model;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Sorted, duplicate free list of the element symbols of an equation. Row {@code i} of an {@link EquationMatrix}
 * holds the balance of element {@code atoms().get(i)}.
 */
public record AtomBasis(List<String> atoms) {

  public AtomBasis {
    Objects.requireNonNull(atoms);
    atoms = List.copyOf(new TreeSet<>(atoms));
  }

  public static AtomBasis of(Collection<String> atoms) {
    return new AtomBasis(List.copyOf(atoms));
  }

  public int size() {
    return atoms.size();
  }

  public String get(int index) {
    return atoms.get(index);
  }

  /**
   * Expands a molecule's count into a column over this basis, missing elements map to zero.
   *
   * @param count molecule atom count, every element must be part of the basis
   * @return counts in basis order
   */
  public BigInteger[] vectorize(AtomCount count) {
    for (String atom : count.atoms()) {
      if (!atoms.contains(atom)) {
        throw new IllegalArgumentException("Atom " + atom + " is not part of basis " + atoms);
      }
    }
    var vector = new BigInteger[atoms.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = count.get(atoms.get(i));
    }
    return vector;
  }
}
