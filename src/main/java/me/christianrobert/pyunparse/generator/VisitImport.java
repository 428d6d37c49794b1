package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.element.Alias;
import me.christianrobert.pyunparse.tree.statement.Import;
import me.christianrobert.pyunparse.tree.statement.ImportFrom;

/**
 * Static helpers for import statements.
 *
 * <h3>Forms:</h3>
 * <pre>
 * import os, numpy as np
 * from collections import OrderedDict
 * from ..util import helper as h      (level 2)
 * from . import sibling               (level 1, no module)
 * </pre>
 */
public class VisitImport {

    public static void importStatement(Import node, RenderContext ctx) {
        ctx.statement(node, "import ");
        ListFormatter.commaList(node.getNames(), ctx);
    }

    /**
     * Relative imports get one leading dot per level in front of the (optional) module name.
     */
    public static void importFrom(ImportFrom node, RenderContext ctx) {
        ctx.statement(node, "from ").write(".".repeat(node.getLevel()));
        if (node.getModule() != null) {
            ctx.write(node.getModule());
        }
        ctx.write(" import ");
        ListFormatter.commaList(node.getNames(), ctx);
    }

    public static void alias(Alias node, RenderContext ctx) {
        ctx.write(node.getName());
        if (node.getAsname() != null) {
            ctx.write(" as " + node.getAsname());
        }
    }
}
