package org.pragmatica.metascript.tree;

/**
 * Any node of a MetaScript tree.
 *
 * <p>Nodes are immutable records. Every child is owned by exactly one parent, and record
 * equality is structural equality, so two trees compare equal when they have the same shape
 * and the same values.
 */
public sealed interface Node permits Program, Statement, Expression, Pattern, MatchCase {}
