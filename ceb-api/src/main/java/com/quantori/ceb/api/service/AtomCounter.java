package com.quantori.ceb.api.service;

import com.quantori.ceb.api.model.AtomCount;
import com.quantori.ceb.api.model.ParseNode;

/**
 * Reduces a parse tree to the number of atoms of each element it contains.
 */
public interface AtomCounter {

  AtomCount countAtoms(ParseNode node);
}
