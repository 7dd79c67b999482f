package com.constlang.playground.repair;

import com.constlang.playground.grammar.Grammar;
import com.constlang.playground.grammar.GrammarState;
import com.constlang.playground.lexer.Diagnostic;
import com.constlang.playground.lexer.Token;
import com.constlang.playground.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Finds a cheapest set of token insertions, deletions and replacements that makes a token
 * stream acceptable to the {@link Grammar}.
 *
 * <p>Uniform-cost search: branches are popped cheapest first, where cost is the number of edits
 * spent on the current statement. Consuming a real terminator closes the statement and resets
 * the cost, so independent statements do not compete for the same budget. Among equally cheap
 * branches the one pushed first wins; children are pushed delete, then replace, then insert,
 * each in {@link TokenKind} order, which makes results reproducible.
 *
 * <p>Two branches at the same cursor and grammar state have the same possible futures, so once
 * one of them has been expanded any later one that is not strictly cheaper is skipped.
 *
 * <p>Two bounds apply. A branch whose statement would need more than {@code maxEditCount}
 * edits is dropped, and the whole search gives up after {@code maxExpandedBranches} pops. In
 * either failure case the input comes back untouched with a single budget diagnostic.
 */
public class RepairSearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(RepairSearchEngine.class);

    public static final int MAX_EDIT_COUNT = 15;
    public static final int MAX_EXPANDED_BRANCHES = 100_000;

    private static final Comparator<Branch> CHEAPEST_FIRST = Comparator
            .comparingInt(Branch::editCount)
            .thenComparingLong(Branch::sequence);

    private final Grammar grammar;
    private final DiagnosticsBuilder diagnosticsBuilder;
    private final int maxEditCount;
    private final int maxExpandedBranches;

    public RepairSearchEngine(Grammar grammar, DiagnosticsBuilder diagnosticsBuilder) {
        this(grammar, diagnosticsBuilder, MAX_EDIT_COUNT, MAX_EXPANDED_BRANCHES);
    }

    public RepairSearchEngine(Grammar grammar, DiagnosticsBuilder diagnosticsBuilder,
            int maxEditCount, int maxExpandedBranches) {
        if (maxEditCount < 0) {
            throw new IllegalArgumentException("maxEditCount must not be negative: " + maxEditCount);
        }
        if (maxExpandedBranches <= 0) {
            throw new IllegalArgumentException("maxExpandedBranches must be positive: " + maxExpandedBranches);
        }
        this.grammar = grammar;
        this.diagnosticsBuilder = diagnosticsBuilder;
        this.maxEditCount = maxEditCount;
        this.maxExpandedBranches = maxExpandedBranches;
    }

    public int maxEditCount() {
        return maxEditCount;
    }

    public RepairResult validate(List<Token> tokens) {
        List<Token> input = List.copyOf(tokens);
        Search search = new Search(input);
        Branch accepted = search.run();

        if (accepted == null) {
            logger.warn("Repair budget exhausted for {} tokens after {} branches",
                    input.size(), search.expanded);
            return new RepairResult(input, List.of(),
                    List.of(Diagnostic.budgetExceeded(maxEditCount)), true, search.expanded);
        }

        List<EditOp> edits = accepted.edits();
        logger.debug("Repaired {} tokens with {} edits after {} branches",
                input.size(), edits.size(), search.expanded);
        return new RepairResult(accepted.tokens(input), edits,
                diagnosticsBuilder.build(edits), false, search.expanded);
    }

    /**
     * State of a single {@link #validate} call.
     */
    private final class Search {
        private final List<Token> input;
        private final PriorityQueue<Branch> queue = new PriorityQueue<>(CHEAPEST_FIRST);
        private final Map<Point, Integer> cheapestExpanded = new HashMap<>();
        private long sequence;
        private int expanded;

        Search(List<Token> input) {
            this.input = input;
        }

        Branch run() {
            queue.add(Branch.root());

            while (!queue.isEmpty()) {
                Branch branch = queue.poll();
                if (!markExpanded(branch)) {
                    continue;
                }
                if (++expanded > maxExpandedBranches) {
                    return null;
                }

                if (branch.cursor() >= input.size()) {
                    if (grammar.isAccepting(branch.state())) {
                        return branch;
                    }
                    completeAtEnd(branch);
                    continue;
                }

                Token current = input.get(branch.cursor());
                if (grammar.allows(branch.state(), current.kind())) {
                    offer(branch.consume(current, grammar.next(branch.state(), current.kind()), ++sequence));
                } else {
                    repair(branch, current);
                }
            }
            return null;
        }

        /**
         * @return {@code false} if a branch at least as cheap was already expanded at the same point
         */
        private boolean markExpanded(Branch branch) {
            Point point = new Point(branch.cursor(), branch.state());
            Integer cheapest = cheapestExpanded.get(point);
            if (cheapest != null && cheapest <= branch.editCount()) {
                return false;
            }
            cheapestExpanded.put(point, branch.editCount());
            return true;
        }

        /** Input ran out mid-statement: try appending each token that could come next. */
        private void completeAtEnd(Branch branch) {
            Token last = branch.lastEmitted();
            for (TokenKind kind : grammar.allowedKinds(branch.state())) {
                Token token = last == null
                        ? SyntheticTokens.create(kind, 1, 1)
                        : SyntheticTokens.after(kind, last);
                offer(branch.insert(token, grammar.next(branch.state(), kind), ++sequence));
            }
        }

        private void repair(Branch branch, Token offending) {
            GrammarState state = branch.state();

            offer(branch.delete(offending, ++sequence));

            for (TokenKind kind : grammar.allowedKinds(state)) {
                Token replacement = SyntheticTokens.at(kind, offending);
                offer(branch.replace(offending, replacement, grammar.next(state, kind), ++sequence));
            }

            for (TokenKind kind : grammar.allowedKinds(state)) {
                Token inserted = SyntheticTokens.at(kind, offending);
                offer(branch.insert(inserted, grammar.next(state, kind), ++sequence));
            }
        }

        private void offer(Branch child) {
            if (child.editCount() <= maxEditCount) {
                queue.add(child);
            }
        }
    }

    private record Point(int cursor, GrammarState state) {
    }
}
