package verbatim.print;

import verbatim.layout.Layout;

/**
 * Canonical rendering rule of one node kind: its layout with default gaps, and whether fresh
 * instances are wrapped in parentheses.
 */
public record Template(Layout layout, boolean parenthesized) {
}
