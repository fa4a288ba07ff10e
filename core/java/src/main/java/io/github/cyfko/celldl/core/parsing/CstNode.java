package io.github.cyfko.celldl.core.parsing;

import io.github.cyfko.celldl.core.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concrete syntax tree node: one application of a {@link GrammarRule}.
 * <p>
 * Children are grouped in slots keyed by a grammar label ({@code "name"}, {@code "lbrace"},
 * {@code "component"}, ...) so consumers address them by meaning rather than position.
 * Within one slot, elements keep source order. A node is flagged {@linkplain #recovered()
 * recovered} when the parser recorded a syntax error while building it; such a node may miss
 * slots the grammar normally requires.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CstNode implements CstElement {

    private final GrammarRule rule;
    private final Map<String, List<CstElement>> children = new LinkedHashMap<>();
    private boolean recovered;

    CstNode(GrammarRule rule) {
        this.rule = rule;
    }

    public GrammarRule rule() {
        return rule;
    }

    public boolean recovered() {
        return recovered;
    }

    void markRecovered() {
        this.recovered = true;
    }

    void add(String label, CstElement element) {
        children.computeIfAbsent(label, k -> new ArrayList<>()).add(element);
    }

    void add(String label, Token token) {
        add(label, new Leaf(token));
    }

    /** Read-only view of all slots. */
    public Map<String, List<CstElement>> children() {
        return Collections.unmodifiableMap(children);
    }

    public boolean has(String label) {
        List<CstElement> slot = children.get(label);
        return slot != null && !slot.isEmpty();
    }

    /**
     * First token stored under {@code label}.
     *
     * @return the token, or {@code null} when the slot holds no token
     */
    public Token token(String label) {
        List<Token> tokens = tokens(label);
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public List<Token> tokens(String label) {
        List<Token> tokens = new ArrayList<>();
        for (CstElement element : children.getOrDefault(label, List.of())) {
            if (element instanceof Leaf leaf) {
                tokens.add(leaf.token());
            }
        }
        return tokens;
    }

    /**
     * First node stored under {@code label}.
     *
     * @return the node, or {@code null} when the slot holds no node
     */
    public CstNode node(String label) {
        List<CstNode> nodes = nodes(label);
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public List<CstNode> nodes(String label) {
        List<CstNode> nodes = new ArrayList<>();
        for (CstElement element : children.getOrDefault(label, List.of())) {
            if (element instanceof CstNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * Depth-first search for the token with the smallest offset under this node.
     */
    @Override
    public Token firstToken() {
        Token first = null;
        for (List<CstElement> slot : children.values()) {
            for (CstElement element : slot) {
                Token candidate = element.firstToken();
                if (candidate != null && (first == null || candidate.offset() < first.offset())) {
                    first = candidate;
                }
            }
        }
        return first;
    }

    @Override
    public String toString() {
        return rule.ruleName() + children.keySet();
    }
}
