package me.christianrobert.pyunparse.tree;

/**
 * A node that remembers the source line it was produced from.
 * Used for the optional {@code # line: n} annotations.
 */
public interface Located {

    /**
     * @return Originating line number, or 0 when unknown
     */
    int getLineNumber();
}
