/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.algebra.poly;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.algebra.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.algebra.ast.AstNode;
import net.hydromatic.algebra.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Polynomial in several atoms with rational coefficients; the normal form
 * produced by {@link Expander}.
 *
 * <p>An atom is a variable, a square root of a rational, or an opaque
 * subtree. Two trees are algebraically equal (as far as the expander can
 * tell) if and only if their normal forms are equal.
 */
public final class MultiPolynomial {
  public static final MultiPolynomial ZERO =
      new MultiPolynomial(ImmutableSortedMap.of());
  public static final MultiPolynomial ONE = constant(Rational.ONE);

  /** Non-zero coefficient of each monomial. */
  public final ImmutableSortedMap<Monomial, Rational> terms;

  private MultiPolynomial(ImmutableSortedMap<Monomial, Rational> terms) {
    this.terms = requireNonNull(terms);
  }

  private static MultiPolynomial of(Map<Monomial, Rational> map) {
    final ImmutableSortedMap.Builder<Monomial, Rational> b =
        ImmutableSortedMap.naturalOrder();
    map.forEach((m, c) -> {
      if (!c.isZero()) {
        b.put(m, c);
      }
    });
    return new MultiPolynomial(b.build());
  }

  public static MultiPolynomial constant(Rational c) {
    return c.isZero()
        ? ZERO
        : new MultiPolynomial(ImmutableSortedMap.of(Monomial.ONE, c));
  }

  public static MultiPolynomial atom(Atom atom) {
    return new MultiPolynomial(
        ImmutableSortedMap.of(Monomial.of(atom, 1), Rational.ONE));
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof MultiPolynomial
            && terms.equals(((MultiPolynomial) o).terms);
  }

  @Override
  public String toString() {
    return toAst(null).toString();
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  /** Whether this polynomial has no atoms (other than radicals). */
  public boolean isConstant() {
    for (Monomial m : terms.keySet()) {
      if (!m.isRational()) {
        return false;
      }
    }
    return true;
  }

  /** Returns the value if this polynomial is a rational constant, otherwise
   * null. */
  public @Nullable Rational rationalValue() {
    if (isZero()) {
      return Rational.ZERO;
    }
    if (terms.size() == 1 && terms.firstKey().atoms.isEmpty()) {
      return terms.get(Monomial.ONE);
    }
    return null;
  }

  public MultiPolynomial add(MultiPolynomial o) {
    final Map<Monomial, Rational> map = new HashMap<>(terms);
    o.terms.forEach((m, c) -> map.merge(m, c, Rational::add));
    return of(map);
  }

  public MultiPolynomial negate() {
    return multiply(Rational.MINUS_ONE);
  }

  public MultiPolynomial subtract(MultiPolynomial o) {
    return add(o.negate());
  }

  public MultiPolynomial multiply(Rational r) {
    final Map<Monomial, Rational> map = new HashMap<>();
    terms.forEach((m, c) -> map.put(m, c.multiply(r)));
    return of(map);
  }

  public MultiPolynomial multiply(MultiPolynomial o) {
    final Map<Monomial, Rational> map = new HashMap<>();
    terms.forEach((m1, c1) ->
        o.terms.forEach((m2, c2) -> {
          final SortedMap<Atom, Integer> atoms = new TreeMap<>(m1.atoms);
          m2.atoms.forEach((a, e) -> atoms.merge(a, e, Integer::sum));
          Rational c = c1.multiply(c2);
          // sqrt(r)^2 = r
          for (Iterator<Map.Entry<Atom, Integer>> i =
                  atoms.entrySet().iterator();
              i.hasNext(); ) {
            final Map.Entry<Atom, Integer> e = i.next();
            final Atom atom = e.getKey();
            if (atom.square != null && e.getValue() >= 2) {
              c = c.multiply(atom.square.pow(e.getValue() / 2));
              if (e.getValue() % 2 == 0) {
                i.remove();
              } else {
                e.setValue(1);
              }
            }
          }
          map.merge(Monomial.of(atoms), c, Rational::add);
        }));
    return of(map);
  }

  public MultiPolynomial pow(int n) {
    checkArgument(n >= 0, "negative power %s", n);
    MultiPolynomial p = ONE;
    MultiPolynomial b = this;
    for (int k = n; k > 0; k >>= 1) {
      if ((k & 1) != 0) {
        p = p.multiply(b);
      }
      if (k > 1) {
        b = b.multiply(b);
      }
    }
    return p;
  }

  /** Returns the highest exponent of a variable. */
  public int degree(String variable) {
    int d = 0;
    for (Monomial m : terms.keySet()) {
      d = Math.max(d, m.exponent(variable));
    }
    return d;
  }

  /** Returns the names of the variables that occur. */
  public ImmutableSortedSet<String> variables() {
    final ImmutableSortedSet.Builder<String> b =
        ImmutableSortedSet.naturalOrder();
    for (Monomial m : terms.keySet()) {
      m.atoms.keySet().forEach(a -> {
        if (a.kind == AtomKind.VARIABLE) {
          b.add(a.key);
        }
      });
    }
    return b.build();
  }

  /** Whether any atom other than the variable, and other than a radical, is
   * present. */
  public boolean hasOtherAtoms(String variable) {
    for (Monomial m : terms.keySet()) {
      for (Atom a : m.atoms.keySet()) {
        if (a.square == null && !a.isVariable(variable)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Converts to a univariate polynomial in {@code variable}, or returns null
   * if some monomial contains another atom.
   */
  public @Nullable Polynomial toPolynomial(String variable) {
    final Map<Integer, Rational> map = new HashMap<>();
    for (Map.Entry<Monomial, Rational> e : terms.entrySet()) {
      final Monomial m = e.getKey();
      final int k = m.exponent(variable);
      if (m.atoms.size() > (k > 0 ? 1 : 0)) {
        return null;
      }
      map.merge(k, e.getValue(), Rational::add);
    }
    return Polynomial.of(map);
  }

  /** Creates a polynomial from a univariate polynomial. */
  public static MultiPolynomial of(Polynomial p, String variable) {
    final Map<Monomial, Rational> map = new HashMap<>();
    final Atom atom = Atom.variable(variable);
    p.toMap().forEach((k, c) ->
        map.put(k == 0 ? Monomial.ONE : Monomial.of(atom, k), c));
    return of(map);
  }

  /**
   * Converts to a tree.
   *
   * <p>If {@code variable} is not null, terms are sorted by descending
   * exponent of that variable; ties, and all terms if it is null, follow
   * monomial order. Negative coefficients after the first term become
   * subtractions.
   */
  public AstNode toAst(@Nullable String variable) {
    final List<Map.Entry<Monomial, Rational>> entries =
        new ArrayList<>(terms.entrySet());
    if (variable != null) {
      entries.sort(
          Comparator.comparing(
              (Map.Entry<Monomial, Rational> e) ->
                  -e.getKey().exponent(variable)));
    }
    final List<AstNode> nodes = new ArrayList<>();
    for (Map.Entry<Monomial, Rational> e : entries) {
      final Rational c = e.getValue();
      final List<AstNode> factors = new ArrayList<>();
      if (!c.abs().isOne() || e.getKey().atoms.isEmpty()) {
        factors.add(ast.number(c.abs()));
      }
      factors.addAll(e.getKey().factors(variable));
      final AstNode node = ast.product(factors);
      nodes.add(c.signum() < 0 ? ast.negate(node) : node);
    }
    return ast.sum(nodes);
  }

  /** Kind of atom. Atoms of earlier kinds sort first. */
  public enum AtomKind {
    VARIABLE,
    RADICAL,
    OPAQUE
  }

  /** Indivisible factor of a monomial. */
  public static final class Atom implements Comparable<Atom> {
    public final AtomKind kind;
    /** Name of a variable, or the canonical text of any other atom. */
    public final String key;
    public final AstNode node;
    /** The rational value of this atom squared, or null. */
    public final @Nullable Rational square;

    private Atom(AtomKind kind, String key, AstNode node,
        @Nullable Rational square) {
      this.kind = requireNonNull(kind);
      this.key = requireNonNull(key);
      this.node = requireNonNull(node);
      this.square = square;
    }

    public static Atom variable(String name) {
      return new Atom(AtomKind.VARIABLE, name, ast.id(name), null);
    }

    /** Creates the atom {@code sqrt(radicand)}; the radicand must be a
     * positive rational that is not a square. */
    public static Atom radical(Rational radicand) {
      checkArgument(radicand.signum() > 0 && radicand.sqrt() == null,
          "bad radicand %s", radicand);
      final AstNode node = ast.sqrt(ast.number(radicand));
      return new Atom(AtomKind.RADICAL, node.toString(), node, radicand);
    }

    /** Creates an atom for a subtree the expander cannot look into. The node
     * should be in canonical form. */
    public static Atom opaque(AstNode node) {
      return new Atom(AtomKind.OPAQUE, node.toString(), node, null);
    }

    public boolean isVariable(String name) {
      return kind == AtomKind.VARIABLE && key.equals(name);
    }

    @Override
    public int hashCode() {
      return key.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
              && kind == ((Atom) o).kind
              && key.equals(((Atom) o).key);
    }

    @Override
    public int compareTo(Atom o) {
      final int c = kind.compareTo(o.kind);
      return c != 0 ? c : key.compareTo(o.key);
    }

    @Override
    public String toString() {
      return key;
    }
  }

  /** Product of atoms raised to positive powers. */
  public static final class Monomial implements Comparable<Monomial> {
    public static final Monomial ONE = new Monomial(ImmutableSortedMap.of());

    public final ImmutableSortedMap<Atom, Integer> atoms;

    private Monomial(ImmutableSortedMap<Atom, Integer> atoms) {
      this.atoms = requireNonNull(atoms);
    }

    static Monomial of(Atom atom, int exponent) {
      return new Monomial(ImmutableSortedMap.of(atom, exponent));
    }

    static Monomial of(SortedMap<Atom, Integer> atoms) {
      return atoms.isEmpty()
          ? ONE
          : new Monomial(ImmutableSortedMap.copyOfSorted(atoms));
    }

    /** Returns the exponent of a variable in this monomial; 0 if absent. */
    public int exponent(String variable) {
      for (Map.Entry<Atom, Integer> e : atoms.entrySet()) {
        if (e.getKey().isVariable(variable)) {
          return e.getValue();
        }
      }
      return 0;
    }

    /** Whether this monomial contains only radicals. */
    boolean isRational() {
      for (Atom a : atoms.keySet()) {
        if (a.square == null) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int hashCode() {
      return atoms.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Monomial && atoms.equals(((Monomial) o).atoms);
    }

    /** Orders by descending total degree, then atom by atom. */
    @Override
    public int compareTo(Monomial o) {
      final int c = Integer.compare(o.totalDegree(), totalDegree());
      if (c != 0) {
        return c;
      }
      final Iterator<Map.Entry<Atom, Integer>> i = atoms.entrySet().iterator();
      final Iterator<Map.Entry<Atom, Integer>> j =
          o.atoms.entrySet().iterator();
      while (i.hasNext() && j.hasNext()) {
        final Map.Entry<Atom, Integer> a = i.next();
        final Map.Entry<Atom, Integer> b = j.next();
        int c2 = a.getKey().compareTo(b.getKey());
        if (c2 != 0) {
          return c2;
        }
        c2 = Integer.compare(b.getValue(), a.getValue());
        if (c2 != 0) {
          return c2;
        }
      }
      return Boolean.compare(i.hasNext(), j.hasNext());
    }

    int totalDegree() {
      int d = 0;
      for (int e : atoms.values()) {
        d += e;
      }
      return d;
    }

    /** Returns the powers of the atoms; the given variable, if present,
     * comes last. */
    List<AstNode> factors(@Nullable String variable) {
      final List<AstNode> factors = new ArrayList<>();
      AstNode last = null;
      for (Map.Entry<Atom, Integer> e : atoms.entrySet()) {
        final AstNode node = ast.power(e.getKey().node, e.getValue());
        if (variable != null && e.getKey().isVariable(variable)) {
          last = node;
        } else {
          factors.add(node);
        }
      }
      if (last != null) {
        factors.add(last);
      }
      return factors;
    }

    @Override
    public String toString() {
      return ast.product(factors(null)).toString();
    }
  }
}

// End MultiPolynomial.java
