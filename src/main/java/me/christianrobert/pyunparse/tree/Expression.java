package me.christianrobert.pyunparse.tree;

/**
 * Marker interface for expression nodes.
 */
public interface Expression extends SyntaxNode {
}
