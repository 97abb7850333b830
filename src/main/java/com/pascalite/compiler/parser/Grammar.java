package com.pascalite.compiler.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LL(1) predict table built from a set of {@link Production}s.
 *
 * Construction computes nullable nonterminals, FIRST and FOLLOW sets and then
 * fills one cell per (nonterminal, lookahead) pair. A cell claimed by two
 * productions fails with {@link GrammarConflictException} unless the caller
 * supplied an explicit resolution for it. Instances are immutable.
 */
public final class Grammar {

    /** The language grammar; the dangling else binds to the nearest if. */
    public static final Grammar PASCAL = new Grammar(
            Arrays.asList(Production.values()),
            Collections.singletonMap(Nonterminal.ELSE_PART,
                    Collections.singletonMap(TokenType.ELSE, Production.ELSE_PART)));

    private final Nonterminal start;
    private final Set<Nonterminal> nullable = EnumSet.noneOf(Nonterminal.class);
    private final Map<Nonterminal, Set<TokenType>> first = new EnumMap<>(Nonterminal.class);
    private final Map<Nonterminal, Set<TokenType>> follow = new EnumMap<>(Nonterminal.class);
    private final Map<Nonterminal, Map<TokenType, Production>> table = new EnumMap<>(Nonterminal.class);

    /**
     * @param productions the rules; the left-hand side of the first one is the start symbol
     * @param resolutions cells where a conflict is expected, mapped to the production that wins
     */
    public Grammar(Collection<Production> productions,
                   Map<Nonterminal, Map<TokenType, Production>> resolutions) {
        List<Production> rules = new ArrayList<>(productions);
        if (rules.isEmpty()) throw new IllegalArgumentException("grammar has no productions");
        this.start = rules.get(0).lhs;

        for (Production p : rules) {
            first.putIfAbsent(p.lhs, EnumSet.noneOf(TokenType.class));
            follow.putIfAbsent(p.lhs, EnumSet.noneOf(TokenType.class));
            table.putIfAbsent(p.lhs, new EnumMap<>(TokenType.class));
        }
        for (Production p : rules) {
            for (GrammarSymbol s : p.rhs()) {
                if (!s.isTerminal() && !first.containsKey((Nonterminal) s)) {
                    throw new IllegalStateException("no production for " + s + " used in " + p);
                }
            }
        }

        computeNullable(rules);
        computeFirst(rules);
        computeFollow(rules);
        buildTable(rules, resolutions);
        freeze();
    }

    public Nonterminal start() {
        return start;
    }

    /** The production to expand {@code nonterminal} with, or null if the lookahead cannot start it. */
    public Production predict(Nonterminal nonterminal, TokenType lookahead) {
        Map<TokenType, Production> row = table.get(nonterminal);
        return (row == null) ? null : row.get(lookahead);
    }

    /** Every token type that selects some production of {@code nonterminal}. */
    public Set<TokenType> expected(Nonterminal nonterminal) {
        Map<TokenType, Production> row = table.get(nonterminal);
        return (row == null) ? Collections.<TokenType>emptySet() : Collections.unmodifiableSet(row.keySet());
    }

    public boolean isNullable(Nonterminal nonterminal) {
        return nullable.contains(nonterminal);
    }

    public Set<TokenType> first(Nonterminal nonterminal) {
        return first.get(nonterminal);
    }

    public Set<TokenType> follow(Nonterminal nonterminal) {
        return follow.get(nonterminal);
    }

    private void computeNullable(List<Production> rules) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : rules) {
                if (!nullable.contains(p.lhs) && sequenceNullable(p.rhs())) {
                    nullable.add(p.lhs);
                    changed = true;
                }
            }
        }
    }

    private void computeFirst(List<Production> rules) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : rules) {
                changed |= first.get(p.lhs).addAll(firstOf(p.rhs()));
            }
        }
    }

    private void computeFollow(List<Production> rules) {
        follow.get(start).add(TokenType.EOF);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : rules) {
                List<GrammarSymbol> rhs = p.rhs();
                for (int i = 0; i < rhs.size(); i++) {
                    if (rhs.get(i).isTerminal()) continue;
                    Set<TokenType> target = follow.get((Nonterminal) rhs.get(i));
                    List<GrammarSymbol> rest = rhs.subList(i + 1, rhs.size());
                    changed |= target.addAll(firstOf(rest));
                    if (sequenceNullable(rest)) {
                        changed |= target.addAll(follow.get(p.lhs));
                    }
                }
            }
        }
    }

    private void buildTable(List<Production> rules, Map<Nonterminal, Map<TokenType, Production>> resolutions) {
        for (Production p : rules) {
            Set<TokenType> lookaheads = firstOf(p.rhs());
            if (sequenceNullable(p.rhs())) lookaheads.addAll(follow.get(p.lhs));

            Map<TokenType, Production> row = table.get(p.lhs);
            for (TokenType t : lookaheads) {
                Production existing = row.get(t);
                if (existing == null || existing == p) {
                    row.put(t, p);
                    continue;
                }
                Production winner = resolved(resolutions, p.lhs, t);
                if (winner == null || (winner != existing && winner != p)) {
                    throw new GrammarConflictException(p.lhs, t, existing, p);
                }
                row.put(t, winner);
            }
        }
    }

    private static Production resolved(Map<Nonterminal, Map<TokenType, Production>> resolutions,
                                       Nonterminal lhs, TokenType t) {
        if (resolutions == null) return null;
        Map<TokenType, Production> row = resolutions.get(lhs);
        return (row == null) ? null : row.get(t);
    }

    private Set<TokenType> firstOf(List<GrammarSymbol> sequence) {
        Set<TokenType> out = EnumSet.noneOf(TokenType.class);
        for (GrammarSymbol s : sequence) {
            if (s.isTerminal()) {
                out.add((TokenType) s);
                return out;
            }
            out.addAll(first.get((Nonterminal) s));
            if (!nullable.contains((Nonterminal) s)) return out;
        }
        return out;
    }

    private boolean sequenceNullable(List<GrammarSymbol> sequence) {
        for (GrammarSymbol s : sequence) {
            if (s.isTerminal() || !nullable.contains((Nonterminal) s)) return false;
        }
        return true;
    }

    private void freeze() {
        for (Map.Entry<Nonterminal, Set<TokenType>> e : first.entrySet()) {
            e.setValue(Collections.unmodifiableSet(e.getValue()));
        }
        for (Map.Entry<Nonterminal, Set<TokenType>> e : follow.entrySet()) {
            e.setValue(Collections.unmodifiableSet(e.getValue()));
        }
        for (Map.Entry<Nonterminal, Map<TokenType, Production>> e : table.entrySet()) {
            e.setValue(Collections.unmodifiableMap(e.getValue()));
        }
    }
}
