package statemigrator.transform;

/**
 * Result of a text rewrite.
 *
 * @param text the rewritten text, identical to the input when nothing changed
 * @param changed true if anything was replaced or inserted
 */
public record TextRewrite(String text, boolean changed) {}
